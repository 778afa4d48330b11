package com.qwen.gateway.util;

import com.qwen.gateway.dto.chat.TurnUsage;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.LongSupplier;

/**
 * 网关指标，输出 Prometheus 文本格式
 * <p>
 * 计数器按 {@code name{label="value"}} 区分序列；轮次延迟按 mode 分直方图
 */
public class Metrics {

    private static final Metrics INSTANCE = new Metrics();

    static final long[] LATENCY_BOUNDS_MS = {250, 1000, 5000, 15000, 30000, 60000, 120000};

    private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();
    private final Map<String, LatencyHistogram> latencies = new ConcurrentHashMap<>();
    private final Map<String, LongSupplier> gauges = new ConcurrentHashMap<>();

    Metrics() {
    }

    public static Metrics instance() {
        return INSTANCE;
    }

    /**
     * 计数器加一
     *
     * @param labels 交替的 label 名和值
     */
    public void increment(String name, String... labels) {
        counter(name, labels).increment();
    }

    public long get(String name, String... labels) {
        LongAdder adder = counters.get(seriesKey(name, labels));
        return adder != null ? adder.sum() : 0;
    }

    /**
     * 注册瞬时值，输出时读取
     */
    public void gauge(String name, LongSupplier supplier) {
        gauges.put(name, supplier);
    }

    /**
     * 记录一次轮次的结果、耗时和 Token 用量
     */
    public void recordTurn(boolean stream, boolean success, long latencyMs, TurnUsage usage) {
        String mode = stream ? "stream" : "non_stream";
        increment("qwen_turns_total", "mode", mode, "result", success ? "success" : "error");
        latencies.computeIfAbsent(mode, k -> new LatencyHistogram()).observe(latencyMs);
        if (usage != null) {
            counter("qwen_tokens_total", "kind", "prompt").add(usage.promptTokens());
            counter("qwen_tokens_total", "kind", "completion").add(usage.completionTokens());
        }
    }

    public void recordToolCall(String toolName) {
        increment("qwen_tool_calls_total", "tool", toolName);
    }

    public String toPrometheusFormat() {
        StringBuilder sb = new StringBuilder();

        String family = null;
        for (Map.Entry<String, LongAdder> e : new TreeMap<>(counters).entrySet()) {
            String name = familyOf(e.getKey());
            if (!name.equals(family)) {
                sb.append("# TYPE ").append(name).append(" counter\n");
                family = name;
            }
            sb.append(e.getKey()).append(' ').append(e.getValue().sum()).append('\n');
        }

        new TreeMap<>(gauges).forEach((name, supplier) -> sb.append("# TYPE ").append(name).append(" gauge\n")
                .append(name).append(' ').append(supplier.getAsLong()).append('\n'));

        if (!latencies.isEmpty()) {
            sb.append("# TYPE qwen_turn_latency_ms histogram\n");
            new TreeMap<>(latencies).forEach((mode, histogram) -> histogram.render(sb, mode));
        }
        return sb.toString();
    }

    private LongAdder counter(String name, String... labels) {
        return counters.computeIfAbsent(seriesKey(name, labels), k -> new LongAdder());
    }

    private static String seriesKey(String name, String... labels) {
        if (labels.length == 0) {
            return name;
        }
        if (labels.length % 2 != 0) {
            throw new IllegalArgumentException("label 名和值必须成对: " + name);
        }
        StringBuilder sb = new StringBuilder(name).append('{');
        for (int i = 0; i < labels.length; i += 2) {
            if (i > 0) sb.append(',');
            sb.append(labels[i]).append("=\"").append(escape(labels[i + 1])).append('"');
        }
        return sb.append('}').toString();
    }

    private static String familyOf(String seriesKey) {
        int brace = seriesKey.indexOf('{');
        return brace < 0 ? seriesKey : seriesKey.substring(0, brace);
    }

    private static String escape(String value) {
        if (value == null) return "";
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    /**
     * 单个 mode 的延迟分布，桶内计数非累积，输出时累加
     */
    private static final class LatencyHistogram {

        private final LongAdder[] buckets = new LongAdder[LATENCY_BOUNDS_MS.length + 1];
        private final LongAdder sum = new LongAdder();

        LatencyHistogram() {
            for (int i = 0; i < buckets.length; i++) {
                buckets[i] = new LongAdder();
            }
        }

        void observe(long latencyMs) {
            int i = 0;
            while (i < LATENCY_BOUNDS_MS.length && latencyMs > LATENCY_BOUNDS_MS[i]) i++;
            buckets[i].increment();
            sum.add(latencyMs);
        }

        void render(StringBuilder sb, String mode) {
            long cumulative = 0;
            for (int i = 0; i < buckets.length; i++) {
                cumulative += buckets[i].sum();
                String le = i < LATENCY_BOUNDS_MS.length ? String.valueOf(LATENCY_BOUNDS_MS[i]) : "+Inf";
                sb.append("qwen_turn_latency_ms_bucket{mode=\"").append(mode)
                        .append("\",le=\"").append(le).append("\"} ").append(cumulative).append('\n');
            }
            sb.append("qwen_turn_latency_ms_sum{mode=\"").append(mode).append("\"} ").append(sum.sum()).append('\n');
            sb.append("qwen_turn_latency_ms_count{mode=\"").append(mode).append("\"} ").append(cumulative).append('\n');
        }
    }
}
