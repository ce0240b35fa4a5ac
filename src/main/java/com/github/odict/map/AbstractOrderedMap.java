package com.github.odict.map;

import com.github.odict.EmptyMapException;
import com.github.odict.KeyNotFoundException;
import com.github.odict.NoSuchNeighborException;
import com.github.odict.OrderedMap;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.NotSerializableException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.io.UncheckedIOException;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * 有序映射的公共骨架 - 模板方法模式
 *
 * <p>参数校验、错误类型与信息、排序、拷贝、字符串形式、相等性都在这里统一实现，
 * 存储引擎只负责底层的链接原语。因此不同 backend 的可观察行为完全一致。
 *
 * <p>所有原语的前置条件都已由本类检查过：调用到原语时，要求存在的 key 一定存在、
 * 要求不存在的 key 一定不存在、需要不同的两个 key 一定不同。失败的操作不会修改任何状态。
 */
public abstract class AbstractOrderedMap<K, V> implements OrderedMap<K, V>, Serializable {
    private static final long serialVersionUID = 1L;

    // 结构修改计数（插入、删除、重排、改名），用于迭代器 fail-fast
    protected transient int modCount;

    // ==================== 存储原语 ====================

    /** 读取已存在 key 的值 */
    protected abstract V valueOf(K key);

    /** 原位替换已存在 key 的值，不改变顺序 */
    protected abstract void replaceValue(K key, V value);

    /** 在尾部追加新 key */
    protected abstract void linkLast(K key, V value);

    /** 摘除已存在的 key */
    protected abstract void unlink(K key);

    /**
     * 存储中与 key 等价的那个 key 本身（按存储自身的等价关系，如排序 Map 的比较器），不存在时为 null。
     * 传给其余原语的 key 都先经过这里，链表中只出现存储里的写法。
     */
    protected abstract K storedKey(K key);

    /** 首/尾 key，空时为 null */
    protected abstract K headKey();
    protected abstract K tailKey();

    /** 后继/前驱 key，到达边界时为 null */
    protected abstract K successor(K key);
    protected abstract K predecessor(K key);

    protected abstract void clearStorage();
    protected abstract void renameKey(K oldKey, K newKey);
    protected abstract void exchange(K a, K b);
    protected abstract void linkBefore(K ref, K key, V value);
    protected abstract void linkAfter(K ref, K key, V value);

    /** 把已存在的 key 移到 ref 之前/之后；key 已在目标位置时直接返回 */
    protected abstract void relinkBefore(K ref, K key);
    protected abstract void relinkAfter(K ref, K key);

    protected abstract <T> Iterator<T> walk(boolean descending, Projection<K, V, T> projection);

    /** 同类型、同配置的空 map */
    protected abstract AbstractOrderedMap<K, V> newEmpty(int expectedSize);

    @FunctionalInterface
    protected interface Projection<K, V, T> {
        T apply(K key, V value);
    }

    // ==================== 基本操作 ====================

    @Override
    public V get(K key) {
        return valueOf(checkPresent(key));
    }

    @Override
    public V get(K key, V defaultValue) {
        return containsKey(key) ? valueOf(key) : defaultValue;
    }

    @Override
    public void put(K key, V value) {
        Objects.requireNonNull(key, "key");
        if (containsKey(key)) {
            replaceValue(key, value);
        } else {
            linkLast(key, value);
            modCount++;
        }
    }

    @Override
    public void remove(K key) {
        unlink(checkPresent(key));
        modCount++;
    }

    @Override
    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public void clear() {
        clearStorage();
        modCount++;
    }

    @Override
    public K firstKey() {
        if (isEmpty()) throw new EmptyMapException("firstKey");
        return headKey();
    }

    @Override
    public K lastKey() {
        if (isEmpty()) throw new EmptyMapException("lastKey");
        return tailKey();
    }

    @Override
    public K nextKey(K key) {
        K next = successor(checkPresent(key));
        if (next == null) throw new NoSuchNeighborException(key, true);
        return next;
    }

    @Override
    public K prevKey(K key) {
        K prev = predecessor(checkPresent(key));
        if (prev == null) throw new NoSuchNeighborException(key, false);
        return prev;
    }

    // ==================== 遍历 ====================

    @Override
    public Iterator<K> keyIterator() {
        return walk(false, (k, v) -> k);
    }

    @Override
    public Iterator<V> valueIterator() {
        return walk(false, (k, v) -> v);
    }

    @Override
    public Iterator<Map.Entry<K, V>> itemIterator() {
        return walk(false, (k, v) -> new AbstractMap.SimpleImmutableEntry<>(k, v));
    }

    @Override
    public Iterator<K> descendingKeyIterator() {
        return walk(true, (k, v) -> k);
    }

    @Override
    public Iterator<V> descendingValueIterator() {
        return walk(true, (k, v) -> v);
    }

    @Override
    public Iterator<Map.Entry<K, V>> descendingItemIterator() {
        return walk(true, (k, v) -> new AbstractMap.SimpleImmutableEntry<>(k, v));
    }

    @Override
    public List<K> keys() {
        return drain(keyIterator());
    }

    @Override
    public List<V> values() {
        return drain(valueIterator());
    }

    @Override
    public List<Map.Entry<K, V>> items() {
        return drain(itemIterator());
    }

    @Override
    public List<K> reversedKeys() {
        return drain(descendingKeyIterator());
    }

    @Override
    public List<V> reversedValues() {
        return drain(descendingValueIterator());
    }

    @Override
    public List<Map.Entry<K, V>> reversedItems() {
        return drain(descendingItemIterator());
    }

    private <T> List<T> drain(Iterator<T> it) {
        List<T> list = new ArrayList<>(size());
        while (it.hasNext()) {
            list.add(it.next());
        }
        return list;
    }

    /**
     * 沿链表行走的迭代器基类，每次 next() 前检查结构修改计数
     */
    protected abstract class OrderIterator<T> implements Iterator<T> {
        private final int expectedModCount = modCount;

        /** 是否还有元素 */
        protected abstract boolean hasMore();

        /** 返回当前元素并前进一步 */
        protected abstract T step();

        @Override
        public final boolean hasNext() {
            return hasMore();
        }

        @Override
        public final T next() {
            if (modCount != expectedModCount) throw new ConcurrentModificationException();
            if (!hasMore()) throw new NoSuchElementException();
            return step();
        }
    }

    // ==================== 拷贝与批量操作 ====================

    @Override
    public OrderedMap<K, V> copy() {
        AbstractOrderedMap<K, V> copy = newEmpty(size());
        for (Iterator<Map.Entry<K, V>> it = itemIterator(); it.hasNext(); ) {
            Map.Entry<K, V> e = it.next();
            copy.linkLast(e.getKey(), e.getValue());
        }
        return copy;
    }

    @Override
    @SuppressWarnings("unchecked")
    public OrderedMap<K, V> deepCopy() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(this);
        } catch (NotSerializableException e) {
            throw new IllegalArgumentException("Keys and values must be Serializable to deep copy: "
                    + e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
            return (OrderedMap<K, V>) in.readObject();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public void update(Iterable<? extends Map.Entry<? extends K, ? extends V>> source) {
        for (Map.Entry<? extends K, ? extends V> e : source) {
            put(e.getKey(), e.getValue());
        }
    }

    @Override
    public void update(Map<? extends K, ? extends V> source) {
        source.forEach(this::put);
    }

    @Override
    public V setDefault(K key, V defaultValue) {
        Objects.requireNonNull(key, "key");
        if (containsKey(key)) {
            return valueOf(key);
        }
        linkLast(key, defaultValue);
        modCount++;
        return defaultValue;
    }

    @Override
    public V pop(K key) {
        K stored = checkPresent(key);
        V value = valueOf(stored);
        unlink(stored);
        modCount++;
        return value;
    }

    @Override
    public V pop(K key, V defaultValue) {
        if (!containsKey(key)) return defaultValue;
        return pop(key);
    }

    @Override
    public Map.Entry<K, V> popItem() {
        if (isEmpty()) throw new EmptyMapException("popItem");
        K key = tailKey();
        V value = valueOf(key);
        unlink(key);
        modCount++;
        return new AbstractMap.SimpleImmutableEntry<>(key, value);
    }

    // ==================== 排序 ====================

    @Override
    @SuppressWarnings("unchecked")
    public void sort() {
        sort((x, y) -> ((Comparable<Object>) x.getValue()).compareTo(y.getValue()), false);
    }

    @Override
    public void sort(Comparator<? super Map.Entry<K, V>> comparator) {
        sort(comparator, false);
    }

    /**
     * 稳定排序后整体重建链表。reverse 为 true 时先升序再整体反转，相等元素的相对顺序也随之反转。
     */
    @Override
    public void sort(Comparator<? super Map.Entry<K, V>> comparator, boolean reverse) {
        Objects.requireNonNull(comparator, "comparator");
        List<Map.Entry<K, V>> items = items();
        items.sort(comparator);
        if (reverse) {
            Collections.reverse(items);
        }
        clearStorage();
        for (Map.Entry<K, V> e : items) {
            linkLast(e.getKey(), e.getValue());
        }
        modCount++;
    }

    @Override
    public <U extends Comparable<? super U>> void sortBy(
            Function<? super Map.Entry<K, V>, ? extends U> keyExtractor, boolean reverse) {
        sort(Comparator.comparing(keyExtractor), reverse);
    }

    // ==================== 重排 ====================

    /**
     * 改名。newKey 在存储看来与 oldKey 是同一个 key 时（例如大小写不敏感的 TreeMap），只替换写法。
     */
    @Override
    public void alterKey(K oldKey, K newKey) {
        Objects.requireNonNull(newKey, "newKey");
        K stored = checkPresent(oldKey);
        if (stored.equals(newKey)) return;
        K existing = storedKey(newKey);
        if (existing != null && !existing.equals(stored)) {
            throw new IllegalArgumentException("Key already exists: " + newKey);
        }
        renameKey(stored, newKey);
        modCount++;
    }

    @Override
    public void swap(K a, K b) {
        checkDistinct("swap", a, b);
        K storedA = checkPresent(a);
        K storedB = checkPresent(b);
        checkDistinct("swap", storedA, storedB);
        exchange(storedA, storedB);
        modCount++;
    }

    @Override
    public void insertBefore(K ref, K key, V value) {
        checkDistinct("insertBefore", ref, key);
        K storedRef = checkPresent(ref);
        checkAbsent(key);
        linkBefore(storedRef, key, value);
        modCount++;
    }

    @Override
    public void insertAfter(K ref, K key, V value) {
        checkDistinct("insertAfter", ref, key);
        K storedRef = checkPresent(ref);
        checkAbsent(key);
        linkAfter(storedRef, key, value);
        modCount++;
    }

    @Override
    public void insertFirst(K key, V value) {
        Objects.requireNonNull(key, "key");
        checkAbsent(key);
        if (isEmpty()) {
            linkLast(key, value);
        } else {
            linkBefore(headKey(), key, value);
        }
        modCount++;
    }

    @Override
    public void insertLast(K key, V value) {
        Objects.requireNonNull(key, "key");
        checkAbsent(key);
        linkLast(key, value);
        modCount++;
    }

    @Override
    public void moveBefore(K ref, K key) {
        checkDistinct("moveBefore", ref, key);
        K storedRef = checkPresent(ref);
        K storedMoved = checkPresent(key);
        checkDistinct("moveBefore", storedRef, storedMoved);
        relinkBefore(storedRef, storedMoved);
        modCount++;
    }

    @Override
    public void moveAfter(K ref, K key) {
        checkDistinct("moveAfter", ref, key);
        K storedRef = checkPresent(ref);
        K storedMoved = checkPresent(key);
        checkDistinct("moveAfter", storedRef, storedMoved);
        relinkAfter(storedRef, storedMoved);
        modCount++;
    }

    @Override
    public void moveFirst(K key) {
        K stored = checkPresent(key);
        K head = headKey();
        if (head.equals(stored)) return;
        relinkBefore(head, stored);
        modCount++;
    }

    @Override
    public void moveLast(K key) {
        K stored = checkPresent(key);
        K tail = tailKey();
        if (tail.equals(stored)) return;
        relinkAfter(tail, stored);
        modCount++;
    }

    // ==================== 视图与字符串 ====================

    @Override
    public Map<K, V> asMap() {
        Map<K, V> map = new HashMap<>();
        for (Iterator<Map.Entry<K, V>> it = itemIterator(); it.hasNext(); ) {
            Map.Entry<K, V> e = it.next();
            map.put(e.getKey(), e.getValue());
        }
        return map;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (Iterator<Map.Entry<K, V>> it = itemIterator(); it.hasNext(); ) {
            Map.Entry<K, V> e = it.next();
            sb.append(render(e.getKey())).append(": ").append(render(e.getValue()));
            if (it.hasNext()) sb.append(", ");
        }
        return sb.append('}').toString();
    }

    @Override
    public String toSourceString() {
        String type = getClass().getSimpleName();
        if (isEmpty()) return type + "()";
        StringBuilder sb = new StringBuilder(type).append("([");
        for (Iterator<Map.Entry<K, V>> it = itemIterator(); it.hasNext(); ) {
            Map.Entry<K, V> e = it.next();
            sb.append('(').append(render(e.getKey())).append(", ").append(render(e.getValue())).append(')');
            if (it.hasNext()) sb.append(", ");
        }
        return sb.append("])").toString();
    }

    private String render(Object o) {
        return o == this ? "(this Map)" : String.valueOf(o);
    }

    /**
     * 顺序敏感的相等：两个有序映射的 (key, value) 序列逐项相等，不区分 backend
     */
    @Override
    public boolean equals(Object o) {
        if (o == this) return true;
        if (!(o instanceof OrderedMap)) return false;
        OrderedMap<?, ?> other = (OrderedMap<?, ?>) o;
        if (other.size() != size()) return false;
        Iterator<Map.Entry<K, V>> mine = itemIterator();
        Iterator<? extends Map.Entry<?, ?>> theirs = other.itemIterator();
        while (mine.hasNext() && theirs.hasNext()) {
            if (!mine.next().equals(theirs.next())) return false;
        }
        return !(mine.hasNext() || theirs.hasNext());
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (Iterator<Map.Entry<K, V>> it = itemIterator(); it.hasNext(); ) {
            h = 31 * h + it.next().hashCode();
        }
        return h;
    }

    // ==================== 校验 ====================

    /** 返回存储中的写法 */
    protected final K checkPresent(K key) {
        Objects.requireNonNull(key, "key");
        K stored = storedKey(key);
        if (stored == null) throw new KeyNotFoundException(key);
        return stored;
    }

    private void checkAbsent(K key) {
        if (containsKey(key)) throw new IllegalArgumentException("Key already exists: " + key);
    }

    private static void checkDistinct(String operation, Object ref, Object key) {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(key, "key");
        if (ref.equals(key)) {
            throw new IllegalArgumentException(operation + "(): keys must differ, got " + key + " twice");
        }
    }

    /**
     * 通过公开的导航接口核对链表一致性：正向遍历恰好访问 size 个不同 key，反向遍历为其逆序。
     * 不一致时抛出 IllegalStateException。
     */
    void checkIntegrity() {
        List<K> forward = new ArrayList<>();
        for (K k = headKey(); k != null; k = successor(k)) {
            if (forward.size() > size()) throw new IllegalStateException("Cycle in forward links");
            forward.add(k);
        }
        List<K> backward = new ArrayList<>();
        for (K k = tailKey(); k != null; k = predecessor(k)) {
            if (backward.size() > size()) throw new IllegalStateException("Cycle in backward links");
            backward.add(k);
        }
        if (forward.size() != size() || forward.stream().distinct().count() != size()) {
            throw new IllegalStateException("Forward walk " + forward + " does not cover " + size() + " keys");
        }
        Collections.reverse(backward);
        if (!forward.equals(backward)) {
            throw new IllegalStateException("Backward walk " + backward + " differs from " + forward);
        }
        if (isEmpty() != (headKey() == null) || isEmpty() != (tailKey() == null)) {
            throw new IllegalStateException("head/tail inconsistent with size " + size());
        }
    }
}
