package org.clifford.exceptions;

/**
 * 门操作条目格式错误：不是 (门名, 比特索引) 二元组，或门名为空/含空白字符，或比特列表为空。
 * @author Ayalyt
 */
public class OperationFormatException extends IllegalArgumentException {

    public OperationFormatException(String message) {
        super(message);
    }

    public OperationFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
