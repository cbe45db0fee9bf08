package org.clifford.exceptions;

/**
 * xs/zs 矩阵维度或形状不匹配（包括不规则的二维数组与空矩阵）。
 * @author Ayalyt
 */
public class ShapeMismatchException extends IllegalArgumentException {

    public ShapeMismatchException(String message) {
        super(message);
    }

    public ShapeMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
