package com.qwen.gateway.session;

import com.qwen.gateway.dto.chat.ChatTurn;
import com.qwen.gateway.dto.chat.ToolCall;
import com.qwen.gateway.exception.ConversationBusyException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContinuityManagerTest {

    private final ContinuityManager manager = new ContinuityManager();

    @Test
    void shouldHashAbsentAndEmptyAssistantTextIdentically() {
        assertThat(ContinuityManager.identityOf("hello", null))
                .isEqualTo(ContinuityManager.identityOf("hello", ""))
                .hasSize(64);
        assertThat(ContinuityManager.identityOf("hello", "hi"))
                .isNotEqualTo(ContinuityManager.identityOf("hello", ""));
        assertThat(ContinuityManager.identityOf(null, null)).isNotBlank();
    }

    @Test
    void shouldReturnSameStateForSamePair() {
        List<ChatTurn> turns = List.of(ChatTurn.user("make a dir"), ChatTurn.assistant("ok", null), ChatTurn.user("again"));

        ConversationState first = manager.resolve(turns);
        ConversationState second = manager.resolve(turns);

        assertThat(second).isSameAs(first);
        assertThat(manager.resolve(List.of(ChatTurn.user("other"), ChatTurn.assistant("ok", null))))
                .isNotSameAs(first);
    }

    @Test
    void shouldAdvanceOnlyWithTailPointer() {
        ConversationState state = manager.resolve(List.of(ChatTurn.user("hi")));

        manager.advance(state, null);
        assertThat(state.tailPointer()).isNull();
        assertThat(state.turnCount()).isZero();

        manager.advance(state, "msg-1");
        assertThat(state.tailPointer()).isEqualTo("msg-1");
        assertThat(state.turnCount()).isEqualTo(1);
    }

    @Test
    void shouldFindStateThroughFirstReplyAlias() {
        ConversationState state = manager.resolve(List.of(ChatTurn.user("make a dir")));
        manager.advance(state, "msg-1");
        manager.bindFirstReply(state, "make a dir", "Done, created x.");

        ConversationState next = manager.resolve(List.of(
                ChatTurn.user("make a dir"),
                ChatTurn.assistant("Done, created x.", null),
                ChatTurn.user("now delete it")));

        assertThat(next).isSameAs(state);
        assertThat(manager.size()).isEqualTo(1);
    }

    @Test
    void shouldKeepToolCallConversationOnOriginalKey() {
        ConversationState state = manager.resolve(List.of(ChatTurn.user("make a dir")));
        manager.advance(state, "msg-1");
        manager.bindFirstReply(state, "make a dir", "");

        ConversationState next = manager.resolve(List.of(
                ChatTurn.user("make a dir"),
                ChatTurn.assistant("", List.of(new ToolCall("call_1", "bash", Map.of("command", "mkdir x"))))));

        assertThat(next).isSameAs(state);
    }

    @Test
    void shouldStartFreshWhenAdvancedConversationIsRestarted() {
        ConversationState state = manager.resolve(List.of(ChatTurn.user("hello")));
        manager.advance(state, "msg-1");

        ConversationState restarted = manager.resolve(List.of(ChatTurn.user("hello")));

        assertThat(restarted).isNotSameAs(state);
        assertThat(restarted.tailPointer()).isNull();
    }

    @Test
    void shouldNotShareBusyAdvancedStateWithNewConversation() {
        ConversationState first = manager.resolve(List.of(ChatTurn.user("hi")));
        first.bindChat("chat-A");
        manager.advance(first, "msg-1");
        manager.bindFirstReply(first, "hi", "Hello there");
        ConversationState.Lease lease = manager.acquire(first, Duration.ofMillis(100));
        try {
            ConversationState fresh = manager.resolve(List.of(ChatTurn.user("hi")));

            assertThat(fresh).isNotSameAs(first);
            assertThat(fresh.tailPointer()).isNull();
            assertThat(fresh.chatId()).isNull();
            // 进行中的会话仍可通过首轮回复找到
            assertThat(manager.resolve(List.of(ChatTurn.user("hi"), ChatTurn.assistant("Hello there", null))))
                    .isSameAs(first);
        } finally {
            lease.close();
        }
    }

    @Test
    void shouldKeepInterruptedStateForRetry() {
        ConversationState state = manager.resolve(List.of(ChatTurn.user("hi")));
        state.bindChat("chat-A");
        manager.advance(state, "msg-1");
        manager.markInterrupted(state);

        ConversationState retry = manager.resolve(List.of(ChatTurn.user("hi")));

        assertThat(retry).isSameAs(state);
        assertThat(retry.tailPointer()).isEqualTo("msg-1");
        assertThat(retry.chatId()).isEqualTo("chat-A");
    }

    @Test
    void shouldClearInterruptionOnNextSuccessfulTurn() {
        ConversationState state = manager.resolve(List.of(ChatTurn.user("hi")));
        manager.advance(state, "msg-1");
        manager.markInterrupted(state);
        assertThat(state.interrupted()).isTrue();

        manager.advance(state, "msg-3");

        assertThat(state.interrupted()).isFalse();
        assertThat(manager.resolve(List.of(ChatTurn.user("hi")))).isNotSameAs(state);
    }

    @Test
    void shouldSerializeTurnsOnSameConversation() throws Exception {
        ConversationState state = manager.resolve(List.of(ChatTurn.user("hi")));
        ConversationState.Lease lease = manager.acquire(state, Duration.ofMillis(100));

        assertThat(state.isLeased()).isTrue();
        assertThatThrownBy(() -> manager.acquire(state, Duration.ofMillis(50)))
                .isInstanceOf(ConversationBusyException.class);

        // 租约可以在其他线程释放
        CompletableFuture.runAsync(lease::close).get(1, TimeUnit.SECONDS);
        lease.close();

        try (ConversationState.Lease again = manager.acquire(state, Duration.ofMillis(100))) {
            assertThat(again.state()).isSameAs(state);
        }
        assertThat(state.isLeased()).isFalse();
    }

    @Test
    void shouldEvictIdleStatesButNotLeasedOnes() {
        ConversationState idle = manager.resolve(List.of(ChatTurn.user("a")));
        ConversationState busy = manager.resolve(List.of(ChatTurn.user("b")));
        ConversationState.Lease lease = manager.acquire(busy, Duration.ofMillis(100));

        int evicted = manager.evictIdle(Duration.ofMillis(-1000));

        assertThat(evicted).isEqualTo(1);
        assertThat(manager.size()).isEqualTo(1);
        assertThat(manager.resolve(List.of(ChatTurn.user("b")))).isSameAs(busy);
        assertThat(manager.resolve(List.of(ChatTurn.user("a")))).isNotSameAs(idle);
        lease.close();
    }
}
