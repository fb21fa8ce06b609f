package com.kilnlang.worker.protocol;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * worker 协议传输层：每行一个 JSON 对象，读自 stdin，写到 stdout
 */
public class WorkerTransport {
    private final BufferedReader reader;
    private final OutputStream output;
    private final Gson gson;

    public WorkerTransport(InputStream input, OutputStream output) {
        this.reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        this.output = output;
        this.gson = new GsonBuilder().disableHtmlEscaping().create();
    }

    /**
     * 读取下一条非空行
     *
     * @return 一行请求文本，如果流结束则返回 null
     */
    public String readLine() throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.trim().isEmpty()) {
                return line;
            }
        }
        return null;
    }

    /**
     * @throws JsonParseException 不是合法的请求对象
     */
    public WorkRequest decode(String line) {
        WorkRequest request = gson.fromJson(line, WorkRequest.class);
        if (request == null) {
            throw new JsonParseException("Empty work request");
        }
        return request;
    }

    public synchronized void writeResponse(WorkResponse response) throws IOException {
        output.write(gson.toJson(response).getBytes(StandardCharsets.UTF_8));
        output.write('\n');
        output.flush();
    }
}
