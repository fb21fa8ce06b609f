package com.kilnlang.ir.codec;

import java.io.IOException;

/**
 * IR 产物格式错误：无法编码（引用未绑定）或无法解码（魔数、版本、索引不合法）
 */
public class IrFormatException extends IOException {

    public IrFormatException(String message) {
        super(message);
    }

    public IrFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
