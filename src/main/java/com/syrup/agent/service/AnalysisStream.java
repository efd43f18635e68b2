package com.syrup.agent.service;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;

import java.io.Closeable;
import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 串流分析的文字片段
 *
 * - 第一次 hasNext() 才真正送出 HTTP 請求
 * - 讀取 SSE（event: / data: 行），每個 data 交給 ChunkDecoder 解出文字
 * - 只能往前讀一次，讀完或 close() 之後就結束
 * - 任何錯誤都變成最後一個 "Error: ..." 片段，不拋例外
 */
@Slf4j
public class AnalysisStream implements Iterator<String>, Closeable {

    /**
     * 把一筆 SSE 事件轉成文字片段
     */
    @FunctionalInterface
    public interface ChunkDecoder {
        Chunk decode(String event, String data);
    }

    /**
     * text：要輸出的文字（可為 null = 略過）；end：串流結束；error：供應商回報的錯誤
     */
    public record Chunk(String text, boolean end, String error) {

        public static final Chunk SKIP = new Chunk(null, false, null);
        public static final Chunk END = new Chunk(null, true, null);

        public static Chunk text(String text) {
            return new Chunk(text, false, null);
        }

        public static Chunk error(String error) {
            return new Chunk(null, false, error);
        }
    }

    private final Call call;
    private final ChunkDecoder decoder;
    private final String initialError;

    private Response response;
    private BufferedSource source;
    private String event;
    private String pending;
    private boolean finished;

    public AnalysisStream(Call call, ChunkDecoder decoder) {
        this(call, decoder, null);
    }

    private AnalysisStream(Call call, ChunkDecoder decoder, String initialError) {
        this.call = call;
        this.decoder = decoder;
        this.initialError = initialError;
    }

    /**
     * 還沒開始就已知失敗（例如組 request 失敗），只輸出一個錯誤片段
     */
    public static AnalysisStream failed(String error) {
        return new AnalysisStream(null, null, error);
    }

    @Override
    public synchronized boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        pending = advance();
        return pending != null;
    }

    @Override
    public synchronized String next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        String chunk = pending;
        pending = null;
        return chunk;
    }

    @Override
    public synchronized void close() {
        finished = true;
        pending = null;
        if (response != null) {
            response.close();
            response = null;
        } else if (call != null && !call.isExecuted()) {
            call.cancel();
        }
    }

    private String advance() {
        if (initialError != null) {
            return fail(initialError);
        }
        try {
            if (source == null) {
                String openError = open();
                if (openError != null) {
                    return fail(openError);
                }
            }
            String line;
            while ((line = source.readUtf8Line()) != null) {
                if (line.isEmpty()) {
                    event = null;
                    continue;
                }
                if (line.startsWith("event:")) {
                    event = line.substring(6).trim();
                    continue;
                }
                if (!line.startsWith("data:")) {
                    continue;
                }
                Chunk chunk = decoder.decode(event, line.substring(5).trim());
                if (chunk.error() != null) {
                    return fail(chunk.error());
                }
                if (chunk.end()) {
                    close();
                    return null;
                }
                if (chunk.text() != null && !chunk.text().isEmpty()) {
                    return chunk.text();
                }
            }
            close();
            return null;
        } catch (IOException | RuntimeException e) {
            log.warn("串流分析中斷: {}", e.getMessage());
            return fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * 送出請求；HTTP 非 2xx 時回傳錯誤訊息
     */
    private String open() throws IOException {
        response = call.execute();
        ResponseBody body = response.body();
        if (!response.isSuccessful() || body == null) {
            String detail = body != null ? body.string() : "";
            log.warn("串流分析 HTTP {} - {}", response.code(), detail);
            return "HTTP " + response.code() + (detail.isBlank() ? "" : " - " + detail);
        }
        source = body.source();
        return null;
    }

    private String fail(String error) {
        close();
        return "Error: " + error;
    }
}
