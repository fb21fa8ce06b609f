package com.kilnlang.compiler.diagnostic;

/**
 * 诊断分类（封闭集合）
 */
public enum DiagnosticCode {
    /** {@code @file} 参数文件无法读取 */
    ARG_FILE_UNREADABLE,
    /** 选项格式错误或缺少必需选项 */
    OPTION_PARSE_ERROR,
    /** 必需输入（平台摘要、输入摘要、包元数据）无法解析或读取 */
    RESOLUTION_ERROR,
    /** 编译器报告的问题 */
    COMPILE_DIAGNOSTIC,
    /** 过滤器无法为被剔除模块建立规范名绑定 */
    FILTER_INVARIANT_VIOLATION,
    ARTIFACT_WRITE_FAILED,
    /** 请求处理过程中的未预期异常 */
    INTERNAL_ERROR,
    /** 帮助文本 */
    USAGE
}
