package com.qwen.gateway.dto.chat;

/**
 * 对话轮次角色
 * <p>
 * TOOL 只存在于客户端协议，发往后端前会被改写成 USER 轮次
 */
public enum Role {

    SYSTEM("system"),
    USER("user"),
    ASSISTANT("assistant"),
    TOOL("tool");

    private final String wireName;

    Role(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 解析客户端角色名，developer 视为 system
     *
     * @return 未知角色返回 null
     */
    public static Role fromWire(String name) {
        if (name == null) return null;
        if ("developer".equals(name)) return SYSTEM;
        for (Role role : values()) {
            if (role.wireName.equals(name)) {
                return role;
            }
        }
        return null;
    }
}
