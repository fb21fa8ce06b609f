package com.kilnlang.compiler.diagnostic;

import com.kilnlang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 诊断条目：严重级别 + 分类 + 消息 + 可选位置 + 附加上下文消息
 */
public final class Diagnostic {

    public enum Severity {
        ERROR("Error"), WARNING("Warning"), INFO("Info");

        private final String label;

        Severity(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final Severity severity;
    private final DiagnosticCode code;
    private final String message;
    private final SourceLocation location;
    private final List<String> context;

    public Diagnostic(Severity severity, DiagnosticCode code, String message,
                      SourceLocation location, List<String> context) {
        this.severity = Objects.requireNonNull(severity, "severity");
        this.code = Objects.requireNonNull(code, "code");
        this.message = Objects.requireNonNull(message, "message");
        this.location = location;
        this.context = context != null
                ? Collections.unmodifiableList(new ArrayList<>(context))
                : Collections.<String>emptyList();
    }

    public static Diagnostic error(DiagnosticCode code, String message) {
        return new Diagnostic(Severity.ERROR, code, message, null, null);
    }

    public static Diagnostic error(DiagnosticCode code, String message, SourceLocation location) {
        return new Diagnostic(Severity.ERROR, code, message, location, null);
    }

    public static Diagnostic info(DiagnosticCode code, String message) {
        return new Diagnostic(Severity.INFO, code, message, null, null);
    }

    public Severity getSeverity() { return severity; }
    public DiagnosticCode getCode() { return code; }
    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }
    public List<String> getContext() { return context; }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * 格式化为构建工具可读的文本。
     * 帮助文本原样输出；其余为 {@code 位置: 级别: 消息}，上下文消息逐行缩进跟随。
     */
    public String format() {
        if (code == DiagnosticCode.USAGE) {
            return message;
        }
        StringBuilder sb = new StringBuilder();
        if (location != null) {
            sb.append(location).append(": ");
        }
        sb.append(severity.getLabel()).append(": ").append(message);
        for (String line : context) {
            sb.append(System.lineSeparator()).append("  ").append(line);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return code + " " + format();
    }
}
