package com.qwen.gateway.dto.chat;

/**
 * 工具参数类型
 */
public enum ParamType {

    STRING("string"),
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    ARRAY("array"),
    OBJECT("object"),
    ENUM("enum"),
    ANY("any");

    private final String wireName;

    ParamType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 从 JSON Schema 的 type 字段解析
     *
     * @param jsonType JSON Schema type（可能为 null）
     * @param hasEnum  是否声明了 enum
     */
    public static ParamType of(String jsonType, boolean hasEnum) {
        if (hasEnum) return ENUM;
        if (jsonType == null) return ANY;
        for (ParamType type : values()) {
            if (type.wireName.equalsIgnoreCase(jsonType)) {
                return type;
            }
        }
        return ANY;
    }
}
