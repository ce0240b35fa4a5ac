package com.github.odict.map;

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * 基于数组槽位的双向链表 - 备用存储引擎
 *
 * <p>key/value 存放在平行数组的槽位中，prev/next 是 int 槽位下标，-1 表示 NIL；
 * 另有 key -> 槽位 的索引。删除的槽位通过 next 数组串成空闲链复用。
 * 交换位置时只需交换两个槽位的内容并更新索引，与相邻关系无关。
 *
 * <p>对外行为与 {@link LinkedOrderedMap} 完全一致。非线程安全。
 */
public class IndexedOrderedMap<K, V> extends AbstractOrderedMap<K, V> {
    private static final long serialVersionUID = 1L;

    static final int NIL = -1;
    private static final int MIN_CAPACITY = 8;
    // 反序列化时按流中声明的 size 预分配的上限，其余靠 grow()
    static final int MAX_PRESIZE = 1 << 12;

    private transient Map<K, Integer> index;
    private transient Object[] keys;
    private transient Object[] vals;
    private transient int[] prev;
    private transient int[] next;

    private transient int head;
    private transient int tail;
    private transient int freeList;  // 空闲槽位链表头
    private transient int used;      // 曾经分配过的最高槽位数

    public IndexedOrderedMap() {
        this(16);
    }

    public IndexedOrderedMap(int initialCapacity) {
        if (initialCapacity < 0) throw new IllegalArgumentException("initialCapacity < 0: " + initialCapacity);
        init(initialCapacity);
    }

    private void init(int capacity) {
        int cap = Math.max(MIN_CAPACITY, capacity);
        index = new HashMap<>();
        keys = new Object[cap];
        vals = new Object[cap];
        prev = new int[cap];
        next = new int[cap];
        head = tail = freeList = NIL;
        used = 0;
    }

    // ==================== 槽位管理 ====================

    private int allocate(K key, V value) {
        int slot;
        if (freeList != NIL) {
            slot = freeList;
            freeList = next[slot];
        } else {
            if (used == keys.length) grow();
            slot = used++;
        }
        keys[slot] = key;
        vals[slot] = value;
        prev[slot] = NIL;
        next[slot] = NIL;
        index.put(key, slot);
        return slot;
    }

    private void release(int slot) {
        keys[slot] = null;
        vals[slot] = null;
        prev[slot] = NIL;
        next[slot] = freeList;
        freeList = slot;
    }

    private void grow() {
        int cap = keys.length << 1;
        keys = Arrays.copyOf(keys, cap);
        vals = Arrays.copyOf(vals, cap);
        prev = Arrays.copyOf(prev, cap);
        next = Arrays.copyOf(next, cap);
    }

    private int slotOf(K key) {
        return index.get(key);
    }

    @SuppressWarnings("unchecked")
    private K keyAt(int slot) {
        return (K) keys[slot];
    }

    @SuppressWarnings("unchecked")
    private V valueAt(int slot) {
        return (V) vals[slot];
    }

    // ==================== 链接工具 ====================

    private void detach(int s) {
        int p = prev[s], n = next[s];
        if (p == NIL) head = n; else next[p] = n;
        if (n == NIL) tail = p; else prev[n] = p;
    }

    /** 把游离槽位 s 接到 r 之前 */
    private void attachBefore(int r, int s) {
        int p = prev[r];
        prev[s] = p;
        next[s] = r;
        if (p == NIL) head = s; else next[p] = s;
        prev[r] = s;
    }

    /** 把游离槽位 s 接到 r 之后 */
    private void attachAfter(int r, int s) {
        int n = next[r];
        prev[s] = r;
        next[s] = n;
        if (n == NIL) tail = s; else prev[n] = s;
        next[r] = s;
    }

    // ==================== 原语实现 ====================

    @Override
    public boolean containsKey(K key) {
        return index.containsKey(key);
    }

    @Override
    public int size() {
        return index.size();
    }

    @Override
    protected K storedKey(K key) {
        Integer slot = index.get(key);
        return slot == null ? null : keyAt(slot);
    }

    @Override
    protected V valueOf(K key) {
        return valueAt(slotOf(key));
    }

    @Override
    protected void replaceValue(K key, V value) {
        vals[slotOf(key)] = value;
    }

    @Override
    protected void linkLast(K key, V value) {
        int s = allocate(key, value);
        if (tail == NIL) {
            head = tail = s;
        } else {
            attachAfter(tail, s);
        }
    }

    @Override
    protected void unlink(K key) {
        int s = index.remove(key);
        detach(s);
        release(s);
    }

    @Override
    protected K headKey() {
        return head == NIL ? null : keyAt(head);
    }

    @Override
    protected K tailKey() {
        return tail == NIL ? null : keyAt(tail);
    }

    @Override
    protected K successor(K key) {
        int n = next[slotOf(key)];
        return n == NIL ? null : keyAt(n);
    }

    @Override
    protected K predecessor(K key) {
        int p = prev[slotOf(key)];
        return p == NIL ? null : keyAt(p);
    }

    @Override
    protected void clearStorage() {
        Arrays.fill(keys, 0, used, null);
        Arrays.fill(vals, 0, used, null);
        index.clear();
        head = tail = freeList = NIL;
        used = 0;
    }

    @Override
    protected void renameKey(K oldKey, K newKey) {
        int s = index.remove(oldKey);
        keys[s] = newKey;
        index.put(newKey, s);
    }

    @Override
    protected void exchange(K a, K b) {
        int sa = slotOf(a), sb = slotOf(b);
        Object v = vals[sa];
        keys[sa] = b;
        vals[sa] = vals[sb];
        keys[sb] = a;
        vals[sb] = v;
        index.put(a, sb);
        index.put(b, sa);
    }

    @Override
    protected void linkBefore(K ref, K key, V value) {
        int r = slotOf(ref);
        attachBefore(r, allocate(key, value));
    }

    @Override
    protected void linkAfter(K ref, K key, V value) {
        int r = slotOf(ref);
        attachAfter(r, allocate(key, value));
    }

    @Override
    protected void relinkBefore(K ref, K key) {
        int r = slotOf(ref), s = slotOf(key);
        if (prev[r] == s) return;
        detach(s);
        attachBefore(r, s);
    }

    @Override
    protected void relinkAfter(K ref, K key) {
        int r = slotOf(ref), s = slotOf(key);
        if (next[r] == s) return;
        detach(s);
        attachAfter(r, s);
    }

    @Override
    protected <T> Iterator<T> walk(boolean descending, Projection<K, V, T> projection) {
        return new OrderIterator<T>() {
            private int cursor = descending ? tail : head;

            @Override
            protected boolean hasMore() {
                return cursor != NIL;
            }

            @Override
            protected T step() {
                int s = cursor;
                cursor = descending ? prev[s] : next[s];
                return projection.apply(keyAt(s), valueAt(s));
            }
        };
    }

    @Override
    protected IndexedOrderedMap<K, V> newEmpty(int expectedSize) {
        return new IndexedOrderedMap<>(expectedSize);
    }

    @Override
    public IndexedOrderedMap<K, V> copy() {
        return (IndexedOrderedMap<K, V>) super.copy();
    }

    /** 已分配过的槽位数（含空闲链中的槽位） */
    int slotsInUse() {
        return used;
    }

    int capacity() {
        return keys.length;
    }

    @Override
    public String toDebugString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName())
                .append(" low level repr head,tail,data: ")
                .append(head == NIL ? "nil" : String.valueOf(head)).append(", ")
                .append(tail == NIL ? "nil" : String.valueOf(tail)).append(", {");
        boolean first = true;
        for (Map.Entry<K, Integer> e : index.entrySet()) {
            int s = e.getValue();
            if (!first) sb.append(", ");
            first = false;
            sb.append(s).append('=').append(e.getKey()).append(" [")
                    .append(prev[s] == NIL ? "nil" : String.valueOf(prev[s])).append(", ")
                    .append(vals[s]).append(", ")
                    .append(next[s] == NIL ? "nil" : String.valueOf(next[s])).append(']');
        }
        return sb.append('}').toString();
    }

    // ==================== 序列化：按顺序写出 (key, value) ====================

    private void writeObject(ObjectOutputStream out) throws IOException {
        out.defaultWriteObject();
        out.writeInt(size());
        for (int s = head; s != NIL; s = next[s]) {
            out.writeObject(keys[s]);
            out.writeObject(vals[s]);
        }
    }

    @SuppressWarnings("unchecked")
    private void readObject(ObjectInputStream in) throws IOException, ClassNotFoundException {
        in.defaultReadObject();
        int size = in.readInt();
        if (size < 0) throw new InvalidObjectException("Negative size: " + size);
        init(Math.min(size, MAX_PRESIZE));
        for (int i = 0; i < size; i++) {
            K key = (K) in.readObject();
            V value = (V) in.readObject();
            if (key == null || index.containsKey(key)) {
                throw new InvalidObjectException("Null or duplicate key in stream: " + key);
            }
            linkLast(key, value);
        }
    }
}
