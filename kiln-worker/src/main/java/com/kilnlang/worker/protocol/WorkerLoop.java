package com.kilnlang.worker.protocol;

import com.google.gson.JsonParseException;
import com.kilnlang.worker.request.RequestResult;
import com.kilnlang.worker.request.RequestRunner;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 持久模式主循环。
 *
 * <p>顺序处理请求，每个请求恰好一个响应，顺序与接收顺序一致。
 * 单个请求抛出的任何异常或错误都只影响该请求的响应。</p>
 */
public class WorkerLoop {
    private static final Logger LOG = Logger.getLogger(WorkerLoop.class.getName());

    /** 请求处理中出现未预期异常，或请求本身无法解析 */
    public static final int EXIT_INTERNAL_ERROR = 1;

    private final WorkerTransport transport;
    private final RequestRunner runner;

    public WorkerLoop(WorkerTransport transport, RequestRunner runner) {
        this.transport = transport;
        this.runner = runner;
    }

    /**
     * 运行到输入流结束
     *
     * @throws IOException 读写协议流失败
     */
    public void run() throws IOException {
        LOG.info("Kiln summary worker 启动");
        int handled = 0;
        String line;
        while ((line = transport.readLine()) != null) {
            WorkRequest request;
            try {
                request = transport.decode(line);
            } catch (JsonParseException e) {
                LOG.log(Level.WARNING, "无法解析请求", e);
                transport.writeResponse(new WorkResponse(EXIT_INTERNAL_ERROR,
                        "Invalid work request: " + e.getMessage() + "\n", 0));
                continue;
            }
            transport.writeResponse(handle(request));
            handled++;
        }
        LOG.info("Kiln summary worker 关闭，共处理 " + handled + " 个请求");
    }

    WorkResponse handle(WorkRequest request) {
        try {
            RequestResult result = runner.run(request.getArguments());
            return new WorkResponse(result.exitCode(), result.formatOutput(), request.getRequestId());
        } catch (Throwable t) {
            LOG.log(Level.SEVERE, "处理请求时出错: " + request.getRequestId(), t);
            StringWriter trace = new StringWriter();
            t.printStackTrace(new PrintWriter(trace));
            return new WorkResponse(EXIT_INTERNAL_ERROR, trace.toString(), request.getRequestId());
        }
    }
}
