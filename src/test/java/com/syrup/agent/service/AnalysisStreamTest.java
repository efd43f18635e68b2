package com.syrup.agent.service;

import okhttp3.Call;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static com.syrup.support.OkHttpMocks.buildResponse;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AnalysisStreamTest {

    private static List<String> drain(AnalysisStream stream) {
        List<String> chunks = new ArrayList<>();
        while (stream.hasNext()) {
            chunks.add(stream.next());
        }
        return chunks;
    }

    @Test
    @DisplayName("建立時不送請求，第一次 hasNext 才執行")
    void executesLazily() throws IOException {
        Call call = mock(Call.class);
        when(call.execute()).thenReturn(buildResponse(200, "data: [DONE]\n\n", "text/event-stream"));

        AnalysisStream stream = new AnalysisStream(call, OpenAiTradingAgent::decodeChunk);
        verify(call, never()).execute();

        assertThat(stream.hasNext()).isFalse();
        verify(call).execute();
    }

    @Test
    @DisplayName("依序輸出片段，[DONE] 之後結束")
    void yieldsChunksUntilDone() throws IOException {
        Call call = mock(Call.class);
        String sse = """
                data: {"choices":[{"delta":{"role":"assistant"}}]}

                data: {"choices":[{"delta":{"content":"SOL "}}]}

                data: {"choices":[{"delta":{"content":"looks strong"}}]}

                data: [DONE]

                data: {"choices":[{"delta":{"content":"ignored"}}]}

                """;
        when(call.execute()).thenReturn(buildResponse(200, sse, "text/event-stream"));

        AnalysisStream stream = new AnalysisStream(call, OpenAiTradingAgent::decodeChunk);

        assertThat(drain(stream)).containsExactly("SOL ", "looks strong");
        assertThatThrownBy(stream::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    @DisplayName("HTTP 錯誤：單一 Error 片段")
    void httpErrorBecomesErrorChunk() throws IOException {
        Call call = mock(Call.class);
        when(call.execute()).thenReturn(buildResponse(401, "{\"error\":{\"message\":\"bad key\"}}"));

        List<String> chunks = drain(new AnalysisStream(call, OpenAiTradingAgent::decodeChunk));

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0)).startsWith("Error: HTTP 401").contains("bad key");
    }

    @Test
    @DisplayName("連線中斷：Error 片段後結束")
    void ioErrorBecomesErrorChunk() throws IOException {
        Call call = mock(Call.class);
        when(call.execute()).thenThrow(new IOException("connection reset"));

        assertThat(drain(new AnalysisStream(call, OpenAiTradingAgent::decodeChunk)))
                .containsExactly("Error: connection reset");
    }

    @Test
    @DisplayName("供應商在串流中回報錯誤：已輸出的片段保留，再接 Error 片段")
    void providerErrorMidStream() throws IOException {
        Call call = mock(Call.class);
        String sse = """
                event: content_block_delta
                data: {"type":"content_block_delta","delta":{"type":"text_delta","text":"Partial"}}

                event: error
                data: {"type":"error","error":{"type":"overloaded_error","message":"Overloaded"}}

                """;
        when(call.execute()).thenReturn(buildResponse(200, sse, "text/event-stream"));

        assertThat(drain(new AnalysisStream(call, AnthropicTradingAgent::decodeChunk)))
                .containsExactly("Partial", "Error: Overloaded");
    }

    @Test
    @DisplayName("尚未開始就 close：取消請求，不再輸出")
    void closeBeforeStart() throws IOException {
        Call call = mock(Call.class);

        AnalysisStream stream = new AnalysisStream(call, OpenAiTradingAgent::decodeChunk);
        stream.close();

        assertThat(stream.hasNext()).isFalse();
        verify(call).cancel();
        verify(call, never()).execute();
    }

    @Test
    @DisplayName("failed()：只有一個錯誤片段")
    void failedStream() {
        assertThat(drain(AnalysisStream.failed("no route"))).containsExactly("Error: no route");
    }
}
