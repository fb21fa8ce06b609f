package com.kilnlang.worker.request;

/**
 * 请求处理阶段，按声明顺序推进
 */
public enum RequestStage {
    PARSING,
    RESOLVING,
    COMPILING,
    FILTERING,
    WRITING,
    DONE
}
