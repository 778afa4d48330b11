package com.qwen.gateway.dto.chat;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 工具参数定义（递归结构）
 *
 * @param name         参数名，数组元素为 null
 * @param type         参数类型
 * @param required     是否必填
 * @param description  描述，可为 null
 * @param enumValues   枚举值（type=ENUM 时非空）
 * @param properties   子属性（type=OBJECT）
 * @param items        元素定义（type=ARRAY），可为 null
 * @param defaultValue 默认值，可为 null
 */
public record ToolParameter(
        String name,
        ParamType type,
        boolean required,
        String description,
        List<String> enumValues,
        List<ToolParameter> properties,
        ToolParameter items,
        Object defaultValue
) {

    public ToolParameter {
        enumValues = enumValues != null ? List.copyOf(enumValues) : List.of();
        properties = properties != null ? List.copyOf(properties) : List.of();
    }

    public static ToolParameter of(String name, ParamType type, boolean required, String description) {
        return new ToolParameter(name, type, required, description, null, null, null, null);
    }

    /**
     * 按名称查找子属性
     */
    public ToolParameter property(String childName) {
        for (ToolParameter p : properties) {
            if (p.name().equals(childName)) {
                return p;
            }
        }
        return null;
    }

    /**
     * 从 JSON Schema 片段构建参数定义
     */
    public static ToolParameter fromSchema(String name, JSONObject schema, boolean required) {
        if (schema == null) {
            return of(name, ParamType.ANY, required, null);
        }
        JSONArray enumArray = schema.getJSONArray("enum");
        boolean hasEnum = enumArray != null && !enumArray.isEmpty();
        ParamType type = ParamType.of(typeOf(schema), hasEnum);

        List<String> enumValues = new ArrayList<>();
        if (hasEnum) {
            for (int i = 0; i < enumArray.size(); i++) {
                enumValues.add(String.valueOf(enumArray.get(i)));
            }
        }

        List<ToolParameter> children = type == ParamType.OBJECT ? propertiesOf(schema) : List.of();
        ToolParameter items = null;
        if (type == ParamType.ARRAY && schema.getJSONObject("items") != null) {
            items = fromSchema(null, schema.getJSONObject("items"), false);
        }

        return new ToolParameter(name, type, required, schema.getString("description"),
                enumValues, children, items, schema.get("default"));
    }

    /**
     * 解析 object schema 的 properties，保持声明顺序
     */
    public static List<ToolParameter> propertiesOf(JSONObject schema) {
        JSONObject props = schema != null ? schema.getJSONObject("properties") : null;
        if (props == null || props.isEmpty()) {
            return List.of();
        }
        Set<String> requiredNames = new HashSet<>();
        JSONArray required = schema.getJSONArray("required");
        if (required != null) {
            for (int i = 0; i < required.size(); i++) {
                requiredNames.add(required.getString(i));
            }
        }
        List<ToolParameter> result = new ArrayList<>();
        for (String key : props.keySet()) {
            result.add(fromSchema(key, props.getJSONObject(key), requiredNames.contains(key)));
        }
        return result;
    }

    private static String typeOf(JSONObject schema) {
        Object type = schema.get("type");
        // type 可能是 ["string", "null"] 这种联合形式，取第一个非 null
        if (type instanceof JSONArray arr) {
            for (int i = 0; i < arr.size(); i++) {
                String t = arr.getString(i);
                if (t != null && !"null".equals(t)) return t;
            }
            return null;
        }
        if (type == null && schema.containsKey("properties")) {
            return "object";
        }
        return type != null ? type.toString() : null;
    }
}
