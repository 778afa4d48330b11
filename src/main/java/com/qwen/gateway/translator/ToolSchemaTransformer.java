package com.qwen.gateway.translator;

import com.qwen.gateway.dto.chat.ParamType;
import com.qwen.gateway.dto.chat.ToolDefinition;
import com.qwen.gateway.dto.chat.ToolParameter;
import com.qwen.gateway.exception.SchemaException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 工具定义 → 后端嵌入式描述块
 * <p>
 * 输出注入到 system 指令中的文本块，嵌套参数按路径扁平化：
 * 对象子属性为 {@code parent.child}，数组元素为 {@code parent[]}
 */
@Component
public class ToolSchemaTransformer {

    public static final String DEFAULT_SYSTEM_PROMPT = "You are a helpful AI assistant.";

    private static final String EXAMPLE_STRING = "example_value";

    /**
     * 将工具定义列表转换为 {@code <tools>} 描述块
     *
     * @throws SchemaException 工具缺少名称或名称重复
     */
    public String transform(List<ToolDefinition> tools) {
        validate(tools);
        StringBuilder sb = new StringBuilder("<tools>\n");
        for (int i = 0; i < tools.size(); i++) {
            if (i > 0) sb.append("\n");
            appendTool(sb, tools.get(i));
        }
        sb.append("</tools>");
        return sb.toString();
    }

    /**
     * 将工具说明追加到 system 指令之后
     *
     * @param systemContent 原 system 指令，为空时使用默认指令
     */
    public String injectInto(String systemContent, List<ToolDefinition> tools) {
        String base = systemContent == null || systemContent.isBlank() ? DEFAULT_SYSTEM_PROMPT : systemContent;
        if (tools == null || tools.isEmpty()) {
            return base;
        }
        return base + """


                ====

                TOOL USE

                You have access to tools that help you accomplish tasks. Call a tool by writing one call block in your reply.

                ## Tool Use Rules
                1. Use at most one tool per message
                2. Put the call block at the end of your message and write nothing after it
                3. Include every required parameter inside <args>
                4. Wait for the tool result before continuing

                ## Call Block Format
                <call>
                <name>tool_name</name>
                <args>
                <parameter1>value1</parameter1>
                <parameter2>value2</parameter2>
                </args>
                </call>

                Nested objects are written as nested tags. Array elements are written as repeated <item> tags.

                ## Available Tools

                """ + transform(tools) + "\n";
    }

    /**
     * 渲染一个调用块，与 {@link ToolCallExtractor} 的解析互逆
     */
    public String renderCall(String name, Map<String, Object> arguments) {
        StringBuilder sb = new StringBuilder();
        sb.append(ToolCallExtractor.CALL_OPEN).append("\n");
        sb.append("<name>").append(name).append("</name>\n");
        sb.append("<args>\n");
        if (arguments != null) {
            arguments.forEach((key, value) -> appendValue(sb, key, value));
        }
        sb.append("</args>\n");
        sb.append(ToolCallExtractor.CALL_CLOSE);
        return sb.toString();
    }

    /**
     * 根据参数定义生成示例参数（必填参数；没有必填时取全部）
     */
    public Map<String, Object> exampleArguments(ToolDefinition tool) {
        List<ToolParameter> params = new ArrayList<>();
        for (ToolParameter p : tool.parameters()) {
            if (p.required()) params.add(p);
        }
        if (params.isEmpty()) {
            params = tool.parameters();
        }
        Map<String, Object> args = new LinkedHashMap<>();
        for (ToolParameter p : params) {
            args.put(p.name(), exampleValue(p));
        }
        return args;
    }

    /**
     * 校验工具定义，在任何后端调用之前执行
     *
     * @throws SchemaException 工具缺少名称或名称重复
     */
    public void validate(List<ToolDefinition> tools) {
        Set<String> names = new HashSet<>();
        for (int i = 0; i < tools.size(); i++) {
            ToolDefinition tool = tools.get(i);
            if (tool.name() == null || tool.name().isBlank()) {
                throw new SchemaException("第 " + (i + 1) + " 个工具缺少名称");
            }
            if (!names.add(tool.name())) {
                throw new SchemaException("工具名称重复: " + tool.name());
            }
        }
    }

    // ==================== 辅助方法 ====================

    private void appendTool(StringBuilder sb, ToolDefinition tool) {
        sb.append("## ").append(tool.name()).append("\n");
        String description = tool.description();
        sb.append("Description: ").append(description != null && !description.isBlank() ? description.strip() : "No description").append("\n");

        if (tool.parameters().isEmpty()) {
            sb.append("Parameters: none\n");
        } else {
            sb.append("Parameters:\n");
            for (ToolParameter p : tool.parameters()) {
                flatten(sb, p.name(), p);
            }
        }

        sb.append("\nUsage:\n");
        sb.append(renderCall(tool.name(), exampleArguments(tool))).append("\n");
    }

    private void flatten(StringBuilder sb, String path, ToolParameter p) {
        appendLine(sb, path, p);
        if (p.type() == ParamType.OBJECT) {
            for (ToolParameter child : p.properties()) {
                flatten(sb, path + "." + child.name(), child);
            }
        } else if (p.type() == ParamType.ARRAY && p.items() != null) {
            String itemPath = path + "[]";
            ToolParameter items = p.items();
            appendLine(sb, itemPath, items);
            for (ToolParameter child : items.properties()) {
                flatten(sb, itemPath + "." + child.name(), child);
            }
        }
    }

    private void appendLine(StringBuilder sb, String path, ToolParameter p) {
        sb.append("- ").append(path).append(": ");
        // 数组元素没有必填概念
        if (p.name() != null) {
            sb.append(p.required() ? "(required) " : "(optional) ");
        }
        sb.append(typeLabel(p));
        if (p.description() != null && !p.description().isBlank()) {
            sb.append(" - ").append(p.description().strip());
        }
        if (p.defaultValue() != null) {
            sb.append(" (default: ").append(p.defaultValue()).append(")");
        }
        sb.append("\n");
    }

    private String typeLabel(ToolParameter p) {
        if (p.type() == ParamType.ENUM) {
            return "enum(" + String.join("|", p.enumValues()) + ")";
        }
        return p.type().wireName();
    }

    private Object exampleValue(ToolParameter p) {
        return switch (p.type()) {
            case NUMBER -> 1.5;
            case INTEGER -> 100L;
            case BOOLEAN -> Boolean.TRUE;
            case ENUM -> p.enumValues().isEmpty() ? EXAMPLE_STRING : p.enumValues().get(0);
            case ARRAY -> List.of(p.items() != null ? exampleValue(p.items()) : EXAMPLE_STRING);
            case OBJECT -> {
                Map<String, Object> nested = new LinkedHashMap<>();
                for (ToolParameter child : p.properties()) {
                    nested.put(child.name(), exampleValue(child));
                }
                yield nested;
            }
            default -> EXAMPLE_STRING;
        };
    }

    @SuppressWarnings("unchecked")
    private void appendValue(StringBuilder sb, String tag, Object value) {
        if (value instanceof Map<?, ?> map) {
            sb.append("<").append(tag).append(">\n");
            ((Map<String, Object>) map).forEach((k, v) -> appendValue(sb, k, v));
            sb.append("</").append(tag).append(">\n");
        } else if (value instanceof List<?> list) {
            sb.append("<").append(tag).append(">\n");
            for (Object item : list) {
                appendValue(sb, ToolCallExtractor.ITEM_TAG, item);
            }
            sb.append("</").append(tag).append(">\n");
        } else {
            sb.append("<").append(tag).append(">")
                    .append(value != null ? value : "")
                    .append("</").append(tag).append(">\n");
        }
    }
}
