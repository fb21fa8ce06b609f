package com.kilnlang.compiler.diagnostic;

/**
 * 诊断回调。编译器每发现一个问题调用一次，回调不得中止编译。
 */
@FunctionalInterface
public interface DiagnosticHandler {

    void onDiagnostic(Diagnostic diagnostic);
}
