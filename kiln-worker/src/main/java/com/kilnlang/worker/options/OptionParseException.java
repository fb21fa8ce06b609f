package com.kilnlang.worker.options;

/**
 * 选项格式错误、未知选项或缺少必需选项
 */
public class OptionParseException extends Exception {

    public OptionParseException(String message) {
        super(message);
    }

    public OptionParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
