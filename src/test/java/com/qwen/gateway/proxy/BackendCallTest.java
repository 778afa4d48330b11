package com.qwen.gateway.proxy;

import com.qwen.gateway.exception.BackendException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendCallTest {

    @Test
    void shouldPumpWholeStream() {
        String sse = "data: {\"choices\":[{\"delta\":{\"content\":\"hi\"}}]}\n\n"
                + "data: {\"choices\":[{\"delta\":{\"content\":\"\",\"status\":\"finished\"}}]}\n\n";
        BackendCall call = new BackendCall(new ByteArrayInputStream(sse.getBytes(StandardCharsets.UTF_8)));
        SseEventParserTest.RecordingCallback callback = new SseEventParserTest.RecordingCallback();

        assertThat(call.pump(callback)).isEqualTo(BackendCall.Outcome.COMPLETED);
        assertThat(callback.events).containsExactly("text:hi");
    }

    @Test
    void shouldReportStreamClosedBeforeFinishedMarker() {
        String sse = "data: {\"choices\":[{\"delta\":{\"content\":\"hi\"}}]}\n\n";
        BackendCall call = new BackendCall(new ByteArrayInputStream(sse.getBytes(StandardCharsets.UTF_8)));
        SseEventParserTest.RecordingCallback callback = new SseEventParserTest.RecordingCallback();

        assertThat(call.pump(callback)).isEqualTo(BackendCall.Outcome.TRUNCATED);
        assertThat(callback.events).containsExactly("text:hi");
    }

    @Test
    void shouldEndBlockedReadWhenExpired() throws Exception {
        BlockingInputStream body = new BlockingInputStream();
        BackendCall call = new BackendCall(body);

        CompletableFuture<BackendCall.Outcome> outcome =
                CompletableFuture.supplyAsync(() -> call.pump(new SseEventParserTest.RecordingCallback()));
        call.expire();

        assertThat(outcome.get(2, TimeUnit.SECONDS)).isEqualTo(BackendCall.Outcome.EXPIRED);
    }

    @Test
    void shouldEndBlockedReadWhenCancelled() throws Exception {
        BackendCall call = new BackendCall(new BlockingInputStream());

        CompletableFuture<BackendCall.Outcome> outcome =
                CompletableFuture.supplyAsync(() -> call.pump(new SseEventParserTest.RecordingCallback()));
        call.cancel();

        assertThat(outcome.get(2, TimeUnit.SECONDS)).isEqualTo(BackendCall.Outcome.CANCELLED);
    }

    @Test
    void shouldWrapReadFailure() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("connection reset");
            }
        };

        assertThatThrownBy(() -> new BackendCall(broken).pump(new SseEventParserTest.RecordingCallback()))
                .isInstanceOf(BackendException.class)
                .extracting("errorCode").isEqualTo("backend_unavailable");
    }
}
