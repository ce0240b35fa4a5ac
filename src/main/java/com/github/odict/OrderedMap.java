package com.github.odict;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 有序映射：key 唯一，同时维护并暴露插入/显式顺序。
 * 单元素的增删改查与重排（swap / move / 相对插入）均为 O(1)。
 *
 * <p>覆盖已有 key 的值不会改变其位置。实现不做内部同步，多线程访问需由调用方串行化。
 * 迭代器是结构上的实时视图（非快照），遍历期间发生结构修改会抛出
 * {@link java.util.ConcurrentModificationException}。
 */
public interface OrderedMap<K, V> extends Iterable<K> {

    V get(K key);
    V get(K key, V defaultValue);
    void put(K key, V value);
    void remove(K key);
    boolean containsKey(K key);
    int size();
    boolean isEmpty();
    void clear();

    K firstKey();
    K lastKey();
    K nextKey(K key);
    K prevKey(K key);

    Iterator<K> keyIterator();
    Iterator<V> valueIterator();
    Iterator<Map.Entry<K, V>> itemIterator();
    Iterator<K> descendingKeyIterator();
    Iterator<V> descendingValueIterator();
    Iterator<Map.Entry<K, V>> descendingItemIterator();

    List<K> keys();
    List<V> values();
    List<Map.Entry<K, V>> items();
    List<K> reversedKeys();
    List<V> reversedValues();
    List<Map.Entry<K, V>> reversedItems();

    /** 浅拷贝：顺序相同，值共享引用 */
    OrderedMap<K, V> copy();

    /** 深拷贝：值经序列化复制，自引用/环状对象图按身份去重 */
    OrderedMap<K, V> deepCopy();

    void update(Iterable<? extends Map.Entry<? extends K, ? extends V>> source);
    void update(Map<? extends K, ? extends V> source);

    V setDefault(K key, V defaultValue);
    V pop(K key);
    V pop(K key, V defaultValue);

    /** 移除并返回最后一个 (key, value) */
    Map.Entry<K, V> popItem();

    /** 按值的自然顺序升序排序 */
    void sort();
    void sort(Comparator<? super Map.Entry<K, V>> comparator);
    void sort(Comparator<? super Map.Entry<K, V>> comparator, boolean reverse);
    <U extends Comparable<? super U>> void sortBy(Function<? super Map.Entry<K, V>, ? extends U> keyExtractor,
                                                  boolean reverse);

    /** 原位改名，位置与邻居不变 */
    void alterKey(K oldKey, K newKey);

    /** 交换两个 key 的位置（值随 key 移动） */
    void swap(K a, K b);

    void insertBefore(K ref, K key, V value);
    void insertAfter(K ref, K key, V value);
    void insertFirst(K key, V value);
    void insertLast(K key, V value);

    /** 把 key 移动到 ref 之前 */
    void moveBefore(K ref, K key);

    /** 把 key 移动到 ref 之后 */
    void moveAfter(K ref, K key);
    void moveFirst(K key);
    void moveLast(K key);

    /** 丢弃顺序的普通 Map 拷贝 */
    Map<K, V> asMap();

    /** 形如 {@code TypeName([(k, v), ...])} 的字符串 */
    String toSourceString();

    /** 底层结构（head、tail、原始条目表），仅供调试，格式不稳定 */
    String toDebugString();

    @Override
    default Iterator<K> iterator() {
        return keyIterator();
    }
}
