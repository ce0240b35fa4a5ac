package com.github.odict.map;

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 以 key 为索引的双向链表 - 参考实现
 *
 * <p>底层 Map 充当 arena，key 充当稳定下标：每个 key 对应一条 {prev, value, next} 记录，
 * prev/next 存的是相邻的 key 而不是对象指针，再加上 head/tail 两个指针。
 * 所有重链接都先读出全部相关邻居，再按"不经过已覆盖记录读取指针"的顺序写入。
 *
 * <p>非线程安全。
 */
public class LinkedOrderedMap<K, V> extends AbstractOrderedMap<K, V> {
    private static final long serialVersionUID = 1L;

    private final BackingMapFactory<K, V> mapFactory;
    private final Map<K, Entry<K, V>> entries;
    private Link<K> head = Link.nil();
    private Link<K> tail = Link.nil();

    public LinkedOrderedMap() {
        this(HashMap::new, 16);
    }

    public LinkedOrderedMap(BackingMapFactory<K, V> mapFactory) {
        this(mapFactory, 16);
    }

    public LinkedOrderedMap(BackingMapFactory<K, V> mapFactory, int initialCapacity) {
        if (mapFactory == null) {
            throw new UnsupportedOperationException("No backing map implementation provided");
        }
        if (initialCapacity < 0) throw new IllegalArgumentException("initialCapacity < 0: " + initialCapacity);
        this.mapFactory = mapFactory;
        this.entries = mapFactory.create(initialCapacity);
    }

    /**
     * 从原始条目表与 head/tail 快照重建，校验全部链接不变式。
     *
     * @throws IllegalStateException 快照链接不一致
     */
    public static <K, V> LinkedOrderedMap<K, V> restore(Map<K, Entry<K, V>> entries, Link<K> head, Link<K> tail) {
        LinkedOrderedMap<K, V> map = new LinkedOrderedMap<>(HashMap::new, entries.size());
        entries.forEach((k, e) -> map.entries.put(k, e.duplicate()));
        map.head = head;
        map.tail = tail;
        map.validateLinks();
        return map;
    }

    /** 原始条目表的拷贝（按当前顺序），供序列化协作方与调试使用 */
    public Map<K, Entry<K, V>> snapshotEntries() {
        Map<K, Entry<K, V>> snapshot = new LinkedHashMap<>();
        for (Link<K> cur = head; !cur.isNil(); ) {
            Entry<K, V> e = entries.get(cur.key());
            snapshot.put(cur.key(), e.duplicate());
            cur = e.next;
        }
        return snapshot;
    }

    public Link<K> head() {
        return head;
    }

    public Link<K> tail() {
        return tail;
    }

    // ==================== 指针工具 ====================

    /** from 的 next 指向 to；from 为 NIL 时更新 head */
    private void pointNext(Link<K> from, Link<K> to) {
        if (from.isNil()) {
            head = to;
        } else {
            entries.get(from.key()).next = to;
        }
    }

    /** from 的 prev 指向 to；from 为 NIL 时更新 tail */
    private void pointPrev(Link<K> from, Link<K> to) {
        if (from.isNil()) {
            tail = to;
        } else {
            entries.get(from.key()).prev = to;
        }
    }

    /** 摘链：前驱与后继互相跳过 e，e 自身指针不清理 */
    private void splice(Entry<K, V> e) {
        pointNext(e.prev, e.next);
        pointPrev(e.next, e.prev);
    }

    // ==================== 原语实现 ====================

    @Override
    public boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    @Override
    public int size() {
        return entries.size();
    }

    /** 指向该记录的链接（前驱的 next 或 head）里保存的就是存储中的写法 */
    @Override
    protected K storedKey(K key) {
        Entry<K, V> e = entries.get(key);
        if (e == null) return null;
        return selfLink(e).key();
    }

    private Link<K> selfLink(Entry<K, V> e) {
        return e.prev.isNil() ? head : entries.get(e.prev.key()).next;
    }

    @Override
    protected V valueOf(K key) {
        return entries.get(key).value;
    }

    @Override
    protected void replaceValue(K key, V value) {
        entries.get(key).value = value;
    }

    @Override
    protected void linkLast(K key, V value) {
        Link<K> last = tail;
        Link<K> self = Link.of(key);
        entries.put(key, new Entry<>(last, value, Link.nil()));
        pointNext(last, self);
        tail = self;
    }

    @Override
    protected void unlink(K key) {
        splice(entries.remove(key));
    }

    @Override
    protected K headKey() {
        return head.isNil() ? null : head.key();
    }

    @Override
    protected K tailKey() {
        return tail.isNil() ? null : tail.key();
    }

    @Override
    protected K successor(K key) {
        Link<K> next = entries.get(key).next;
        return next.isNil() ? null : next.key();
    }

    @Override
    protected K predecessor(K key) {
        Link<K> prev = entries.get(key).prev;
        return prev.isNil() ? null : prev.key();
    }

    @Override
    protected void clearStorage() {
        entries.clear();
        head = Link.nil();
        tail = Link.nil();
    }

    @Override
    protected void renameKey(K oldKey, K newKey) {
        Entry<K, V> e = entries.remove(oldKey);
        entries.put(newKey, e);
        Link<K> self = Link.of(newKey);
        pointNext(e.prev, self);
        pointPrev(e.next, self);
    }

    @Override
    protected void exchange(K a, K b) {
        Entry<K, V> ea = entries.get(a);
        Entry<K, V> eb = entries.get(b);
        Link<K> la = Link.of(a);
        Link<K> lb = Link.of(b);

        if (ea.next.refersTo(b)) {
            swapAdjacent(la, ea, lb, eb);
            return;
        }
        if (eb.next.refersTo(a)) {
            swapAdjacent(lb, eb, la, ea);
            return;
        }

        // 不相邻：四个邻居都不是 a/b 本身，先全部读出再写
        Link<K> pa = ea.prev, na = ea.next;
        Link<K> pb = eb.prev, nb = eb.next;

        ea.prev = pb;
        ea.next = nb;
        eb.prev = pa;
        eb.next = na;

        pointNext(pa, lb);
        pointPrev(na, lb);
        pointNext(pb, la);
        pointPrev(nb, la);
    }

    /** first 紧挨在 second 之前：p, first, second, n -> p, second, first, n */
    private void swapAdjacent(Link<K> first, Entry<K, V> ef, Link<K> second, Entry<K, V> es) {
        Link<K> p = ef.prev;
        Link<K> n = es.next;

        es.prev = p;
        es.next = first;
        ef.prev = second;
        ef.next = n;

        pointNext(p, second);
        pointPrev(n, first);
    }

    @Override
    protected void linkBefore(K ref, K key, V value) {
        Entry<K, V> r = entries.get(ref);
        Link<K> p = r.prev;
        Link<K> self = Link.of(key);
        entries.put(key, new Entry<>(p, value, Link.of(ref)));
        pointNext(p, self);
        r.prev = self;
    }

    @Override
    protected void linkAfter(K ref, K key, V value) {
        Entry<K, V> r = entries.get(ref);
        Link<K> n = r.next;
        Link<K> self = Link.of(key);
        entries.put(key, new Entry<>(Link.of(ref), value, n));
        pointPrev(n, self);
        r.next = self;
    }

    @Override
    protected void relinkBefore(K ref, K key) {
        Entry<K, V> r = entries.get(ref);
        Entry<K, V> e = entries.get(key);
        if (r.prev.refersTo(key)) return;
        Link<K> self = Link.of(key);

        splice(e);
        // 摘链后重新读取 ref 的前驱（key 原本可能紧跟在 ref 之后）
        Link<K> p = r.prev;
        e.prev = p;
        e.next = Link.of(ref);
        pointNext(p, self);
        r.prev = self;
    }

    @Override
    protected void relinkAfter(K ref, K key) {
        Entry<K, V> r = entries.get(ref);
        Entry<K, V> e = entries.get(key);
        if (r.next.refersTo(key)) return;
        Link<K> self = Link.of(key);

        splice(e);
        Link<K> n = r.next;
        e.prev = Link.of(ref);
        e.next = n;
        pointPrev(n, self);
        r.next = self;
    }

    @Override
    protected <T> Iterator<T> walk(boolean descending, Projection<K, V, T> projection) {
        return new OrderIterator<T>() {
            private Link<K> cursor = descending ? tail : head;

            @Override
            protected boolean hasMore() {
                return !cursor.isNil();
            }

            @Override
            protected T step() {
                K key = cursor.key();
                Entry<K, V> e = entries.get(key);
                cursor = descending ? e.prev : e.next;
                return projection.apply(key, e.value);
            }
        };
    }

    @Override
    protected LinkedOrderedMap<K, V> newEmpty(int expectedSize) {
        return new LinkedOrderedMap<>(mapFactory, expectedSize);
    }

    @Override
    public LinkedOrderedMap<K, V> copy() {
        return (LinkedOrderedMap<K, V>) super.copy();
    }

    @Override
    public String toDebugString() {
        return getClass().getSimpleName() + " low level repr head,tail,data: "
                + head + ", " + tail + ", " + entries;
    }

    // ==================== 不变式校验 ====================

    /**
     * 直接在原始条目表上核对链接不变式：
     * head/tail 与 NIL 端点一致、相邻记录互指、从 head 出发恰好走完全部 key 到达 tail。
     */
    void validateLinks() {
        if (entries.isEmpty()) {
            if (!head.isNil() || !tail.isNil()) {
                throw new IllegalStateException("Empty map must have nil head and tail, got " + head + ", " + tail);
            }
            return;
        }
        if (head.isNil() || tail.isNil()) {
            throw new IllegalStateException("Non-empty map has nil head or tail: " + head + ", " + tail);
        }
        int visited = 0;
        Link<K> prev = Link.nil();
        Link<K> cur = head;
        while (!cur.isNil()) {
            Entry<K, V> e = entries.get(cur.key());
            if (e == null) throw new IllegalStateException("Dangling link to " + cur);
            if (!e.prev.equals(prev)) {
                throw new IllegalStateException("Entry " + cur + " has prev " + e.prev + ", expected " + prev);
            }
            if (++visited > entries.size()) throw new IllegalStateException("Cycle detected at " + cur);
            prev = cur;
            cur = e.next;
        }
        if (!prev.equals(tail)) {
            throw new IllegalStateException("Forward walk ends at " + prev + ", tail is " + tail);
        }
        if (visited != entries.size()) {
            throw new IllegalStateException("Reached " + visited + " of " + entries.size() + " entries");
        }
        for (K key : entries.keySet()) {
            Link<K> self = selfLink(entries.get(key));
            if (!self.refersTo(key)) {
                throw new IllegalStateException("Entry " + key + " is linked as " + self);
            }
        }
    }

    private void readObject(ObjectInputStream in) throws IOException, ClassNotFoundException {
        in.defaultReadObject();
        if (mapFactory == null || entries == null || head == null || tail == null) {
            throw new InvalidObjectException("Incomplete ordered map snapshot");
        }
        try {
            validateLinks();
        } catch (IllegalStateException e) {
            InvalidObjectException ioe = new InvalidObjectException(e.getMessage());
            ioe.initCause(e);
            throw ioe;
        }
    }
}
