package com.github.odict;

import java.util.NoSuchElementException;

/**
 * 键存在，但在请求方向上没有邻居（尾部的 next，头部的 prev）。
 * 属于正常的边界情况，不是结构错误。
 */
public class NoSuchNeighborException extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    private final transient Object key;

    public NoSuchNeighborException(Object key, boolean next) {
        super((next ? "No next key after " : "No previous key before ") + key);
        this.key = key;
    }

    public Object getKey() {
        return key;
    }
}
