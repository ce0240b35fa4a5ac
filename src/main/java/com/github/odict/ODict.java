package com.github.odict;

import com.github.odict.map.BackingMapFactory;
import com.github.odict.map.IndexedOrderedMap;
import com.github.odict.map.LinkedOrderedMap;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 有序映射构建器 - 仿 Caffeine.newBuilder() 的链式配置
 *
 * <pre>{@code
 * OrderedMap<String, Integer> map = ODict.<String, Integer>newBuilder()
 *         .initialCapacity(64)
 *         .backend(Backend.INDEXED)
 *         .build(List.of(Map.entry("a", 1), Map.entry("b", 2)));
 * }</pre>
 */
public final class ODict<K, V> {
    static final int UNSET_INT = -1;
    static final int DEFAULT_INITIAL_CAPACITY = 16;

    int initialCapacity = UNSET_INT;
    Backend backend = Backend.LINKED;
    BackingMapFactory<K, V> backingMap;

    private ODict() {}

    public static <K, V> ODict<K, V> newBuilder() {
        return new ODict<>();
    }

    public ODict<K, V> initialCapacity(int initialCapacity) {
        if (initialCapacity < 0) throw new IllegalArgumentException("initialCapacity < 0: " + initialCapacity);
        this.initialCapacity = initialCapacity;
        return this;
    }

    public ODict<K, V> backend(Backend backend) {
        this.backend = Objects.requireNonNull(backend, "backend");
        return this;
    }

    /**
     * 指定底层关联存储（仅 LINKED 引擎可用），例如 {@code cap -> new TreeMap<>()}
     */
    public ODict<K, V> backingMap(BackingMapFactory<K, V> factory) {
        this.backingMap = Objects.requireNonNull(factory, "factory");
        return this;
    }

    public OrderedMap<K, V> build() {
        int capacity = initialCapacity == UNSET_INT ? DEFAULT_INITIAL_CAPACITY : initialCapacity;
        if (backingMap != null && backend != Backend.LINKED) {
            throw new IllegalStateException("backingMap() requires the LINKED backend, got " + backend);
        }
        return switch (backend) {
            case LINKED -> new LinkedOrderedMap<K, V>(linkedStorage(), capacity);
            case INDEXED -> new IndexedOrderedMap<K, V>(capacity);
        };
    }

    private BackingMapFactory<K, V> linkedStorage() {
        return backingMap != null ? backingMap : HashMap::new;
    }

    /** 按给定 (key, value) 序列的顺序构建 */
    public OrderedMap<K, V> build(Iterable<? extends Map.Entry<? extends K, ? extends V>> items) {
        OrderedMap<K, V> map = build();
        map.update(items);
        return map;
    }

    /** 从普通 Map 构建；顺序即该 Map 的迭代顺序，对 HashMap 而言是未定义的 */
    public OrderedMap<K, V> build(Map<? extends K, ? extends V> source) {
        OrderedMap<K, V> map = build();
        map.update(source);
        return map;
    }

    /** 所有 key 共享同一个 value 引用，不逐个复制 */
    public OrderedMap<K, V> buildFromKeys(Iterable<? extends K> keys, V value) {
        OrderedMap<K, V> map = build();
        for (K key : keys) {
            map.put(key, value);
        }
        return map;
    }

    // ==================== 默认配置的快捷方法 ====================

    public static <K, V> OrderedMap<K, V> create() {
        return ODict.<K, V>newBuilder().build();
    }

    public static <K, V> OrderedMap<K, V> of(Iterable<? extends Map.Entry<? extends K, ? extends V>> items) {
        return ODict.<K, V>newBuilder().build(items);
    }

    public static <K, V> OrderedMap<K, V> copyOf(Map<? extends K, ? extends V> source) {
        return ODict.<K, V>newBuilder().build(source);
    }

    public static <K, V> OrderedMap<K, V> fromKeys(Iterable<? extends K> keys, V value) {
        return ODict.<K, V>newBuilder().buildFromKeys(keys, value);
    }
}
