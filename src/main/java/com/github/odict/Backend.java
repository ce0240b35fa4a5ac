package com.github.odict;

/**
 * 存储引擎类型，两者对外行为完全一致
 */
public enum Backend {
    LINKED,     // 以 key 为索引的双向链表（Map<K, Entry> + head/tail）
    INDEXED     // 基于数组槽位的双向链表（int 下标 + 空闲链）
}
