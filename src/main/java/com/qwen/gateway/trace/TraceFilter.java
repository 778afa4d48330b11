package com.qwen.gateway.trace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * 追踪 WebFilter
 * <p>
 * 为每个 API 请求创建 TraceContext，绑定到 exchange attributes，
 * 并在响应头中返回 turnId 便于排查
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(TraceFilter.class);
    public static final String TRACE_CONTEXT_ATTR = "traceContext";
    public static final String TURN_ID_HEADER = "X-Turn-Id";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String path = request.getPath().value();

        // 仅对 API 请求创建追踪
        if (!path.startsWith("/v1/")) {
            return chain.filter(exchange);
        }

        TraceContext ctx = TraceContext.create();
        exchange.getAttributes().put(TRACE_CONTEXT_ATTR, ctx);
        exchange.getResponse().getHeaders().set(TURN_ID_HEADER, ctx.turnId());

        log.debug("追踪开始: turnId={}, path={}", ctx.turnId(), path);

        return chain.filter(exchange)
                .doFinally(signal -> log.debug("追踪结束: turnId={}, duration={}ms, success={}",
                        ctx.turnId(), ctx.durationMs(), ctx.success()));
    }

    /**
     * 从 exchange 获取 TraceContext，没有则新建
     */
    public static TraceContext getTraceContext(ServerWebExchange exchange) {
        TraceContext ctx = exchange.getAttribute(TRACE_CONTEXT_ATTR);
        return ctx != null ? ctx : TraceContext.create();
    }
}
