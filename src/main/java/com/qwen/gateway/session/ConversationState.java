package com.qwen.gateway.session;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单个会话的续接状态
 * <p>
 * chatId 只绑定一次；tailPointer 只在后端轮次成功后由 {@link ContinuityManager#advance} 更新。
 * 同一时刻只允许一个轮次持有租约
 */
public class ConversationState {

    private final String conversationId;
    // 租约不绑定线程，流式响应会在另一个线程上释放
    private final Semaphore permit = new Semaphore(1);

    private volatile String chatId;
    private volatile String tailPointer;
    private volatile int turnCount;
    private volatile Instant lastAccess;
    private volatile boolean interrupted;

    public ConversationState(String conversationId) {
        this.conversationId = conversationId;
        this.lastAccess = Instant.now();
    }

    /**
     * 绑定后端 chat id，已绑定时忽略
     */
    public synchronized void bindChat(String chatId) {
        if (this.chatId == null) {
            this.chatId = chatId;
        }
    }

    synchronized void advance(String newTailPointer) {
        this.tailPointer = newTailPointer;
        this.turnCount++;
        this.interrupted = false;
        touch();
    }

    void markInterrupted() {
        this.interrupted = true;
    }

    void touch() {
        this.lastAccess = Instant.now();
    }

    /**
     * 尝试获取租约
     *
     * @return 超时返回 null
     */
    Lease tryAcquire(Duration timeout) throws InterruptedException {
        if (!permit.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            return null;
        }
        touch();
        return new Lease();
    }

    public boolean isLeased() {
        return permit.availablePermits() == 0;
    }

    public boolean isIdleSince(Instant threshold) {
        return !isLeased() && lastAccess.isBefore(threshold);
    }

    // --- getter ---

    public String conversationId() { return conversationId; }
    public String chatId() { return chatId; }
    public String tailPointer() { return tailPointer; }
    public int turnCount() { return turnCount; }
    public boolean interrupted() { return interrupted; }

    /**
     * 会话租约，close 幂等
     */
    public final class Lease implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean(false);

        private Lease() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                touch();
                permit.release();
            }
        }

        public ConversationState state() {
            return ConversationState.this;
        }
    }
}
