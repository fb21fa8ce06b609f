package com.kilnlang.worker.protocol;

import java.util.Collections;
import java.util.List;

/**
 * 持久 worker 协议的请求（Gson 映射）
 */
public class WorkRequest {
    private List<String> arguments;
    private List<Input> inputs;
    private int requestId;

    public List<String> getArguments() {
        return arguments != null ? arguments : Collections.<String>emptyList();
    }

    /** 构建工具附带的输入清单，仅作记录 */
    public List<Input> getInputs() {
        return inputs != null ? inputs : Collections.<Input>emptyList();
    }

    public int getRequestId() {
        return requestId;
    }

    public static class Input {
        private String path;
        private String digest;

        public String getPath() {
            return path;
        }

        public String getDigest() {
            return digest;
        }
    }
}
