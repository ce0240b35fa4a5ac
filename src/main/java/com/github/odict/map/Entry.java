package com.github.odict.map;

import java.io.Serializable;

/**
 * 单个 key 的存储记录 {prev, value, next}。
 * 由所属 map 独占，只有重新链接时才修改指针，覆盖值不动指针。
 */
public final class Entry<K, V> implements Serializable {
    private static final long serialVersionUID = 1L;

    Link<K> prev;
    V value;
    Link<K> next;

    public Entry(Link<K> prev, V value, Link<K> next) {
        this.prev = prev;
        this.value = value;
        this.next = next;
    }

    public Link<K> getPrev() { return prev; }
    public V getValue() { return value; }
    public Link<K> getNext() { return next; }

    Entry<K, V> duplicate() {
        return new Entry<>(prev, value, next);
    }

    @Override
    public String toString() {
        return "[" + prev + ", " + value + ", " + next + "]";
    }
}
