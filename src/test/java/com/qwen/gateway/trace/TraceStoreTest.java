package com.qwen.gateway.trace;

import com.qwen.gateway.dao.RequestDAO;
import com.qwen.gateway.dao.ResponseDAO;
import com.qwen.gateway.dto.chat.TurnUsage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class TraceStoreTest {

    private final RequestDAO requestDAO = mock(RequestDAO.class);
    private final ResponseDAO responseDAO = mock(ResponseDAO.class);
    private final TraceStore store = new TraceStore(requestDAO, responseDAO);

    @AfterEach
    void tearDown() throws InterruptedException {
        store.shutdown();
    }

    @Test
    void shouldWriteRequestWithModelAndStreamFromBackendPayload() {
        store.recordTurn("turn-1", "conv-1", "{\"messages\":[]}", "{\"model\":\"qwen3-max\",\"stream\":true}");

        verify(requestDAO, timeout(2000)).insert("turn-1", "conv-1", "qwen3-max", true,
                "{\"messages\":[]}", "{\"model\":\"qwen3-max\",\"stream\":true}");
    }

    @Test
    void shouldTolerateUnparsableBackendPayload() {
        store.recordTurn("turn-2", "conv-1", "{}", "not json");

        verify(requestDAO, timeout(2000)).insert("turn-2", "conv-1", null, false, "{}", "not json");
    }

    @Test
    void shouldWriteResultWithUsage() {
        store.recordResult("turn-3", "{\"id\":\"x\"}", "msg-2", TurnUsage.of(3, 4), 120, null);

        verify(responseDAO, timeout(2000)).insert("turn-3", "{\"id\":\"x\"}", "msg-2", 3, 4, 7, 120L, null);
    }

    @Test
    void shouldKeepWritingAfterDatabaseFailure() {
        doThrow(new DataAccessResourceFailureException("locked")).when(responseDAO)
                .insert(anyString(), any(), any(), anyInt(), anyInt(), anyInt(), anyLong(), any());

        store.recordResult("turn-4", null, null, null, 5, "backend_timeout: slow");
        store.recordTurn("turn-5", "conv-2", "{}", null);

        verify(responseDAO, timeout(2000)).insert("turn-4", null, null, 0, 0, 0, 5L, "backend_timeout: slow");
        verify(requestDAO, timeout(2000)).insert(anyString(), anyString(), isNull(), anyBoolean(), anyString(), isNull());
    }
}
