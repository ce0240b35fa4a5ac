package com.github.odict.map;

import java.io.Serializable;
import java.util.Objects;

/**
 * 链表指针：要么是 NIL 哨兵，要么引用另一个 key。
 * 比较基于标签而非身份，反序列化后的 NIL 仍只与 NIL 相等。
 */
public final class Link<K> implements Serializable {
    private static final long serialVersionUID = 1L;

    private static final Link<?> NIL = new Link<>(null, true);

    private final K key;
    private final boolean nil;

    private Link(K key, boolean nil) {
        this.key = key;
        this.nil = nil;
    }

    @SuppressWarnings("unchecked")
    public static <K> Link<K> nil() {
        return (Link<K>) NIL;
    }

    public static <K> Link<K> of(K key) {
        return new Link<>(Objects.requireNonNull(key, "key"), false);
    }

    public boolean isNil() {
        return nil;
    }

    /** NIL 上调用视为结构错误 */
    public K key() {
        if (nil) throw new IllegalStateException("nil link has no key");
        return key;
    }

    public boolean refersTo(Object other) {
        return !nil && key.equals(other);
    }

    private Object readResolve() {
        return nil ? NIL : this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Link)) return false;
        Link<?> other = (Link<?>) o;
        if (nil || other.nil) return nil == other.nil;
        return key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return nil ? 0 : key.hashCode();
    }

    @Override
    public String toString() {
        return nil ? "nil" : String.valueOf(key);
    }
}
