package com.kilnlang.worker.protocol;

/**
 * 持久 worker 协议的响应（Gson 映射）
 */
public class WorkResponse {
    private final int exitCode;
    private final String output;
    private final int requestId;

    public WorkResponse(int exitCode, String output, int requestId) {
        this.exitCode = exitCode;
        this.output = output;
        this.requestId = requestId;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getOutput() {
        return output;
    }

    public int getRequestId() {
        return requestId;
    }
}
