package com.github.odict;

import java.util.NoSuchElementException;

/**
 * 键不存在 - 查找、删除、pop(无默认值)、邻居查询、相对插入的参照键缺失时抛出
 */
public class KeyNotFoundException extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    private final transient Object key;

    public KeyNotFoundException(Object key) {
        super(String.valueOf(key));
        this.key = key;
    }

    public Object getKey() {
        return key;
    }
}
