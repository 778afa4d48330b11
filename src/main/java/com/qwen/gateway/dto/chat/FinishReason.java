package com.qwen.gateway.dto.chat;

/**
 * 结束原因
 */
public enum FinishReason {

    STOP("stop"),
    TOOL_CALLS("tool_calls"),
    LENGTH("length"),
    ERROR("error");

    private final String wireName;

    FinishReason(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
