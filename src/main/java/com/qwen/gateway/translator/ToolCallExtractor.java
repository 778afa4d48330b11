package com.qwen.gateway.translator;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.qwen.gateway.dto.chat.ParamType;
import com.qwen.gateway.dto.chat.ToolCall;
import com.qwen.gateway.dto.chat.ToolDefinition;
import com.qwen.gateway.dto.chat.ToolParameter;
import com.qwen.gateway.exception.ExtractionException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 从后端生成的文本中提取调用块
 * <p>
 * 只识别第一个 {@code <call>...</call>}，块之前的文本原样保留给用户，
 * 块之后的文本丢弃（每轮最多一次工具调用）
 */
@Component
public class ToolCallExtractor {

    public static final String CALL_OPEN = "<call>";
    public static final String CALL_CLOSE = "</call>";
    public static final String ITEM_TAG = "item";

    private static final Pattern OPEN_TAG = Pattern.compile("<([A-Za-z_][\\w.\\-]*)>");
    private static final Pattern INTEGER = Pattern.compile("-?(0|[1-9]\\d{0,17})");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+([eE][-+]?\\d+)?");

    private final Supplier<String> idGenerator;

    public ToolCallExtractor() {
        this(ToolCallExtractor::generateCallId);
    }

    public ToolCallExtractor(Supplier<String> idGenerator) {
        this.idGenerator = idGenerator;
    }

    public static String generateCallId() {
        return "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }

    /**
     * 提取调用块（不做类型约束，值按字面推断）
     */
    public ExtractionResult extract(String text) {
        return extract(text, List.of());
    }

    /**
     * 提取调用块
     *
     * @param text  完整或部分响应文本
     * @param tools 本次请求的工具定义，用于参数类型转换
     * @return 未找到完整的定界符对时 hasCall=false，textBefore 为全文
     * @throws ExtractionException 定界符存在但内容无法解析
     */
    public ExtractionResult extract(String text, List<ToolDefinition> tools) {
        if (text == null || text.isEmpty()) {
            return ExtractionResult.noCall("");
        }
        int start = text.indexOf(CALL_OPEN);
        if (start < 0) {
            return ExtractionResult.noCall(text);
        }
        int end = text.indexOf(CALL_CLOSE, start + CALL_OPEN.length());
        if (end < 0) {
            return ExtractionResult.noCall(text);
        }

        String body = text.substring(start + CALL_OPEN.length(), end);
        ToolCall call = parseBlock(body, tools != null ? tools : List.of());
        return new ExtractionResult(true, text.substring(0, start), call);
    }

    /**
     * 查找调用块起始位置
     *
     * @return 未找到返回 -1
     */
    public int findCallStart(CharSequence text, int from) {
        return indexOf(text, CALL_OPEN, from);
    }

    /**
     * 查找调用块结束位置（{@code </call>} 之后的下标）
     *
     * @return 未闭合返回 -1
     */
    public int findCallEnd(CharSequence text, int callStart) {
        int close = indexOf(text, CALL_CLOSE, callStart + CALL_OPEN.length());
        return close < 0 ? -1 : close + CALL_CLOSE.length();
    }

    /**
     * 查找安全截断位置，末尾可能是 {@code <call>} 前缀的部分不输出
     */
    public int safeEnd(CharSequence text, int from) {
        int length = text.length();
        for (int suffixLen = Math.min(length - from, CALL_OPEN.length() - 1); suffixLen >= 1; suffixLen--) {
            boolean matches = true;
            for (int i = 0; i < suffixLen; i++) {
                if (text.charAt(length - suffixLen + i) != CALL_OPEN.charAt(i)) {
                    matches = false;
                    break;
                }
            }
            if (matches) {
                return length - suffixLen;
            }
        }
        return length;
    }

    // ==================== 调用块解析 ====================

    private ToolCall parseBlock(String body, List<ToolDefinition> tools) {
        List<Node> nodes = parseSequence(body);
        if (nodes == null) {
            throw new ExtractionException("调用块结构无法解析");
        }

        Node nameNode = null;
        Node argsNode = null;
        for (Node node : nodes) {
            if ("name".equals(node.tag()) && nameNode == null) nameNode = node;
            if ("args".equals(node.tag()) && argsNode == null) argsNode = node;
        }
        if (nameNode == null || !nameNode.isLeaf() || nameNode.text().isBlank()) {
            throw new ExtractionException("调用块缺少 <name>");
        }

        String name = nameNode.text().strip();
        ToolDefinition tool = findTool(tools, name);
        Map<String, Object> arguments = argsNode == null ? new LinkedHashMap<>() : parseArguments(argsNode, tool);
        return new ToolCall(idGenerator.get(), name, arguments);
    }

    private Map<String, Object> parseArguments(Node argsNode, ToolDefinition tool) {
        if (argsNode.isLeaf()) {
            String raw = argsNode.text().strip();
            if (raw.isEmpty()) {
                return new LinkedHashMap<>();
            }
            // 兼容模型直接输出 JSON 参数
            try {
                JSONObject json = JSON.parseObject(raw);
                if (json != null) {
                    return new LinkedHashMap<>(json);
                }
            } catch (JSONException e) {
                throw new ExtractionException("<args> 既不是参数标签也不是 JSON: " + e.getMessage());
            }
            throw new ExtractionException("<args> 内容无法解析");
        }

        Map<String, Object> arguments = new LinkedHashMap<>();
        for (Node child : argsNode.children()) {
            ToolParameter schema = tool != null ? tool.parameter(child.tag()) : null;
            putValue(arguments, child.tag(), toValue(child, schema));
        }
        return arguments;
    }

    private Object toValue(Node node, ToolParameter schema) {
        ParamType type = schema != null ? schema.type() : null;

        // 标量参数取原文，值里的标签（HTML、XML 等）不展开
        if (isScalar(type)) {
            return coerce(stripLineBreaks(node.text()), schema);
        }

        if (!node.isLeaf()) {
            if (allItems(node)) {
                List<Object> list = new ArrayList<>();
                ToolParameter itemSchema = schema != null ? schema.items() : null;
                for (Node child : node.children()) {
                    list.add(toValue(child, itemSchema));
                }
                return list;
            }
            Map<String, Object> map = new LinkedHashMap<>();
            for (Node child : node.children()) {
                ToolParameter childSchema = schema != null ? schema.property(child.tag()) : null;
                putValue(map, child.tag(), toValue(child, childSchema));
            }
            return map;
        }

        String text = stripLineBreaks(node.text());
        if (type == ParamType.ARRAY) {
            if (text.isBlank()) return new ArrayList<>();
            Object parsed = tryParseJson(text);
            return parsed instanceof List<?> ? parsed : new ArrayList<>(List.of(coerce(text, schema.items())));
        }
        if (type == ParamType.OBJECT) {
            if (text.isBlank()) return new LinkedHashMap<>();
            Object parsed = tryParseJson(text);
            return parsed instanceof Map<?, ?> ? parsed : text;
        }
        // 未声明类型的空容器渲染为 <x>\n</x>，与空串 <x></x> 区分
        if (text.isEmpty() && !node.text().isEmpty()) {
            return new LinkedHashMap<>();
        }
        return coerce(text, schema);
    }

    private boolean isScalar(ParamType type) {
        return type == ParamType.STRING || type == ParamType.ENUM || type == ParamType.NUMBER
                || type == ParamType.INTEGER || type == ParamType.BOOLEAN;
    }

    /**
     * 叶子值类型转换：有定义按定义转换，无定义按字面推断，转换失败保留原文
     */
    private Object coerce(String text, ToolParameter schema) {
        ParamType type = schema != null ? schema.type() : ParamType.ANY;
        String trimmed = text.strip();
        switch (type) {
            case STRING, ENUM:
                return text;
            case INTEGER:
                if (INTEGER.matcher(trimmed).matches()) return Long.parseLong(trimmed);
                return text;
            case NUMBER:
                if (INTEGER.matcher(trimmed).matches()) return Long.parseLong(trimmed);
                if (DECIMAL.matcher(trimmed).matches()) return Double.parseDouble(trimmed);
                return text;
            case BOOLEAN:
                if ("true".equalsIgnoreCase(trimmed)) return Boolean.TRUE;
                if ("false".equalsIgnoreCase(trimmed)) return Boolean.FALSE;
                return text;
            default:
                if ("true".equals(trimmed)) return Boolean.TRUE;
                if ("false".equals(trimmed)) return Boolean.FALSE;
                if (INTEGER.matcher(trimmed).matches()) return Long.parseLong(trimmed);
                if (DECIMAL.matcher(trimmed).matches()) return Double.parseDouble(trimmed);
                return text;
        }
    }

    @SuppressWarnings("unchecked")
    private void putValue(Map<String, Object> target, String key, Object value) {
        Object existing = target.get(key);
        if (existing == null) {
            target.put(key, value);
            return;
        }
        // 同名标签重复出现，合并为数组
        if (existing instanceof List<?> list) {
            ((List<Object>) list).add(value);
        } else {
            List<Object> merged = new ArrayList<>();
            merged.add(existing);
            merged.add(value);
            target.put(key, merged);
        }
    }

    private Object tryParseJson(String text) {
        String trimmed = text.strip();
        if (!trimmed.startsWith("[") && !trimmed.startsWith("{")) {
            return null;
        }
        try {
            return JSON.parse(trimmed);
        } catch (JSONException e) {
            return null;
        }
    }

    private boolean allItems(Node node) {
        for (Node child : node.children()) {
            if (!ITEM_TAG.equals(child.tag())) return false;
        }
        return true;
    }

    private ToolDefinition findTool(List<ToolDefinition> tools, String name) {
        for (ToolDefinition tool : tools) {
            if (name.equals(tool.name())) return tool;
        }
        return null;
    }

    // ==================== 标签解析 ====================

    /**
     * 解析由若干元素组成的片段，元素之间只允许空白
     *
     * @return 结构非法返回 null
     */
    private List<Node> parseSequence(String src) {
        List<Node> nodes = new ArrayList<>();
        int i = skipWhitespace(src, 0);
        while (i < src.length()) {
            Node node = parseElement(src, i);
            if (node == null) {
                return null;
            }
            nodes.add(node);
            i = skipWhitespace(src, node.end());
        }
        return nodes;
    }

    /**
     * 解析 pos 处的元素：优先按容器解析（子元素），失败则按叶子解析（原文）
     */
    private Node parseElement(String src, int pos) {
        Matcher m = OPEN_TAG.matcher(src);
        m.region(pos, src.length());
        if (!m.lookingAt()) {
            return null;
        }
        String tag = m.group(1);
        String closeTag = "</" + tag + ">";
        int contentStart = m.end();

        List<Node> children = new ArrayList<>();
        int i = skipWhitespace(src, contentStart);
        while (i < src.length() && src.charAt(i) == '<' && !src.startsWith("</", i)) {
            Node child = parseElement(src, i);
            if (child == null) {
                children = null;
                break;
            }
            children.add(child);
            i = skipWhitespace(src, child.end());
        }
        if (children != null && !children.isEmpty() && src.startsWith(closeTag, i)) {
            return new Node(tag, src.substring(contentStart, i), children, i + closeTag.length());
        }

        int close = findClose(src, contentStart, tag);
        if (close < 0) {
            return null;
        }
        return new Node(tag, src.substring(contentStart, close), List.of(), close + closeTag.length());
    }

    /**
     * 查找匹配的闭合标签，处理同名嵌套
     */
    private int findClose(String src, int from, String tag) {
        String open = "<" + tag + ">";
        String close = "</" + tag + ">";
        int depth = 0;
        int i = from;
        while (i < src.length()) {
            int nextClose = src.indexOf(close, i);
            if (nextClose < 0) return -1;
            int nextOpen = src.indexOf(open, i);
            if (nextOpen >= 0 && nextOpen < nextClose) {
                depth++;
                i = nextOpen + open.length();
                continue;
            }
            if (depth == 0) return nextClose;
            depth--;
            i = nextClose + close.length();
        }
        return -1;
    }

    private int skipWhitespace(String src, int from) {
        int i = from;
        while (i < src.length() && Character.isWhitespace(src.charAt(i))) i++;
        return i;
    }

    private String stripLineBreaks(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && (text.charAt(start) == '\n' || text.charAt(start) == '\r')) start++;
        while (end > start && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) end--;
        return text.substring(start, end);
    }

    private static int indexOf(CharSequence text, String needle, int from) {
        if (text instanceof String s) {
            return s.indexOf(needle, from);
        }
        return text.toString().indexOf(needle, Math.max(from, 0));
    }

    /**
     * @param text 开闭标签之间的原文，容器元素同样保留
     */
    private record Node(String tag, String text, List<Node> children, int end) {
        boolean isLeaf() {
            return children.isEmpty();
        }
    }

    /**
     * 提取结果
     *
     * @param hasCall    是否提取到调用
     * @param textBefore 调用块之前的文本（无调用时为全文）
     * @param call       提取到的调用，无则为 null
     */
    public record ExtractionResult(boolean hasCall, String textBefore, ToolCall call) {

        public static ExtractionResult noCall(String text) {
            return new ExtractionResult(false, text, null);
        }
    }
}
