package com.github.odict;

import java.util.NoSuchElementException;

/**
 * 空容器异常：firstKey / lastKey / popItem 作用于空 map
 */
public class EmptyMapException extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    public EmptyMapException(String operation) {
        super(operation + "(): ordered map is empty");
    }
}
