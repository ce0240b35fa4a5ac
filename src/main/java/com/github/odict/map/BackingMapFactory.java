package com.github.odict.map;

import java.io.Serializable;
import java.util.Map;

/**
 * 底层关联存储工厂（默认 HashMap::new，也可用 TreeMap 获得基于比较器的 key 相等性）。
 * 继承 Serializable，方法引用随 map 一起序列化。
 */
@FunctionalInterface
public interface BackingMapFactory<K, V> extends Serializable {
    Map<K, Entry<K, V>> create(int initialCapacity);
}
