package com.qwen.gateway.dto.chat;

/**
 * Token 使用量
 */
public record TurnUsage(int promptTokens, int completionTokens, int totalTokens) {

    public static final TurnUsage EMPTY = new TurnUsage(0, 0, 0);

    public static TurnUsage of(int promptTokens, int completionTokens) {
        return new TurnUsage(promptTokens, completionTokens, promptTokens + completionTokens);
    }
}
