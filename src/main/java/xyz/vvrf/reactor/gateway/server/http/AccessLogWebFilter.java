package xyz.vvrf.reactor.gateway.server.http;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * HTTP 访问日志：方法、路径、状态码与耗时。
 * 开启 disable-health-logs 时不记录 {@code GET /} 健康检查。
 */
@Slf4j
public class AccessLogWebFilter implements WebFilter {

    private final boolean disableHealthLogs;

    public AccessLogWebFilter(boolean disableHealthLogs) {
        this.disableHealthLogs = disableHealthLogs;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        if (disableHealthLogs && isHealthCheck(request)) {
            return chain.filter(exchange);
        }
        long start = System.nanoTime();
        return chain.filter(exchange)
                .doFinally(signal -> log.info("{} {} -> {} ({}ms)",
                        request.getMethodValue(),
                        request.getPath().value(),
                        exchange.getResponse().getStatusCode() != null ? exchange.getResponse().getStatusCode().value() : "-",
                        (System.nanoTime() - start) / 1_000_000));
    }

    static boolean isHealthCheck(ServerHttpRequest request) {
        return HttpMethod.GET.equals(request.getMethod()) && "/".equals(request.getPath().value());
    }
}
