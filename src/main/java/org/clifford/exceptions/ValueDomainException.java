package org.clifford.exceptions;

/**
 * 矩阵元素超出 {0,1} 取值范围。
 * @author Ayalyt
 */
public class ValueDomainException extends IllegalArgumentException {

    public ValueDomainException(String message) {
        super(message);
    }

    public ValueDomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
