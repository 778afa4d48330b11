package com.qwen.gateway.session;

import com.qwen.gateway.dto.chat.ChatTurn;
import com.qwen.gateway.dto.chat.Role;
import com.qwen.gateway.exception.ConversationBusyException;
import com.qwen.gateway.exception.GatewayException;
import com.qwen.gateway.util.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 会话续接管理
 * <p>
 * 会话身份由首个 user 轮次和首个 assistant 轮次的内容派生，不依赖客户端提供的 session id。
 * 同一身份下的轮次通过租约串行执行，不同会话完全并行
 */
@Component
public class ContinuityManager {

    private static final Logger log = LoggerFactory.getLogger(ContinuityManager.class);

    private final Map<String, ConversationState> states = new ConcurrentHashMap<>();

    public ContinuityManager() {
        Metrics.instance().gauge("qwen_conversations_active", this::size);
    }

    /**
     * 计算会话身份
     * <p>
     * assistant 文本缺失时按空串处理，两者结果相同
     */
    public static String identityOf(String firstUser, String firstAssistant) {
        String user = firstUser != null ? firstUser.strip() : "";
        String assistant = firstAssistant != null ? firstAssistant.strip() : "";
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest((user + "||" + assistant).getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JVM 不支持 SHA-256", e);
        }
    }

    /**
     * 查找或创建会话状态
     * <p>
     * 请求里没有 assistant 轮次、而已有状态已经推进过时，视为内容相同的新会话，替换为新状态。
     * 被替换的状态若仍有进行中的轮次，该轮次持有原引用，别名键不受影响。
     * 例外：上一轮在客户端收到完整回复前断开（{@link #markInterrupted}），同样的请求视为重试，沿用原状态
     */
    public ConversationState resolve(List<ChatTurn> turns) {
        String firstUser = null;
        String firstAssistant = null;
        for (ChatTurn turn : turns) {
            if (firstUser == null && turn.role() == Role.USER) {
                firstUser = turn.content();
            } else if (firstAssistant == null && turn.role() == Role.ASSISTANT) {
                firstAssistant = turn.content();
            }
        }
        boolean hasAssistant = firstAssistant != null;
        String key = identityOf(firstUser, firstAssistant);

        return states.compute(key, (k, existing) -> {
            if (existing == null) {
                log.info("新建会话: conversationId={}", shortId(k));
                Metrics.instance().increment("qwen_conversations_created_total");
                return new ConversationState(k);
            }
            if (!hasAssistant && existing.turnCount() > 0) {
                if (existing.interrupted()) {
                    log.info("重试被中断的轮次，沿用会话: conversationId={}, tail={}",
                            shortId(k), existing.tailPointer());
                    existing.touch();
                    return existing;
                }
                log.info("首轮内容相同的新会话，重置状态: conversationId={}", shortId(k));
                Metrics.instance().increment("qwen_conversations_created_total");
                return new ConversationState(k);
            }
            existing.touch();
            return existing;
        });
    }

    /**
     * 后端轮次成功后推进尾指针
     *
     * @param newTailId 后端返回的尾消息 id，为 null 时不推进
     */
    public void advance(ConversationState state, String newTailId) {
        if (newTailId == null || newTailId.isEmpty()) {
            log.warn("后端未返回尾指针，会话不推进: conversationId={}", shortId(state.conversationId()));
            return;
        }
        state.advance(newTailId);
        log.debug("会话推进: conversationId={}, turn={}, tail={}",
                shortId(state.conversationId()), state.turnCount(), newTailId);
    }

    /**
     * 标记本轮在客户端收到完整回复前断开，下一次相同请求按重试处理。
     * 之后任何一次成功推进都会清除标记
     */
    public void markInterrupted(ConversationState state) {
        state.markInterrupted();
        log.debug("会话轮次被中断: conversationId={}, tail={}", shortId(state.conversationId()), state.tailPointer());
    }

    /**
     * 首轮成功后，以 (首个 user, 本轮回复) 为身份再登记一次，
     * 客户端下一次请求带上这条回复时能命中同一状态
     */
    public void bindFirstReply(ConversationState state, String firstUser, String replyText) {
        String alias = identityOf(firstUser, replyText);
        if (!alias.equals(state.conversationId())) {
            states.put(alias, state);
        }
    }

    /**
     * 获取会话租约
     *
     * @throws ConversationBusyException 超时仍未获得
     */
    public ConversationState.Lease acquire(ConversationState state, Duration timeout) {
        try {
            ConversationState.Lease lease = state.tryAcquire(timeout);
            if (lease == null) {
                throw new ConversationBusyException(shortId(state.conversationId()));
            }
            return lease;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("等待会话租约时被中断");
        }
    }

    /**
     * 清理空闲会话（持有租约的不清理）
     *
     * @return 清理的会话数
     */
    public int evictIdle(Duration maxIdle) {
        Instant threshold = Instant.now().minus(maxIdle);
        Map<ConversationState, Boolean> evicted = new IdentityHashMap<>();
        states.entrySet().removeIf(entry -> {
            if (entry.getValue().isIdleSince(threshold)) {
                evicted.put(entry.getValue(), Boolean.TRUE);
                return true;
            }
            return false;
        });
        return evicted.size();
    }

    /**
     * 当前会话数（别名不重复计数）
     */
    public int size() {
        Map<ConversationState, Boolean> distinct = new IdentityHashMap<>();
        states.values().forEach(s -> distinct.put(s, Boolean.TRUE));
        return distinct.size();
    }

    public static String shortId(String conversationId) {
        return conversationId != null && conversationId.length() > 12
                ? conversationId.substring(0, 12)
                : conversationId;
    }
}
