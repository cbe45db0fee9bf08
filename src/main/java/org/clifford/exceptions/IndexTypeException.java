package org.clifford.exceptions;

/**
 * 比特索引不是整数，也不是由整数组成的可迭代对象。
 * @author Ayalyt
 */
public class IndexTypeException extends IllegalArgumentException {

    public IndexTypeException(String message) {
        super(message);
    }

    public IndexTypeException(String message, Throwable cause) {
        super(message, cause);
    }
}
