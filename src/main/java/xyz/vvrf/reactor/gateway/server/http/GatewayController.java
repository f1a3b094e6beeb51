package xyz.vvrf.reactor.gateway.server.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.gateway.codec.DataRequestJsonConverter;
import xyz.vvrf.reactor.gateway.core.GatewayErrorCode;
import xyz.vvrf.reactor.gateway.core.GatewayException;
import xyz.vvrf.reactor.gateway.core.LazyDataRequest;
import xyz.vvrf.reactor.gateway.dispatch.TargetExecutorMatcher;
import xyz.vvrf.reactor.gateway.server.GatewayInfo;
import xyz.vvrf.reactor.gateway.streaming.RequestStreamer;
import xyz.vvrf.reactor.gateway.topology.TopologyGraph;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 网关的 HTTP 前端。
 * <ul>
 *     <li>{@code GET /}：健康检查，返回 200 空响应</li>
 *     <li>{@code GET /status}：版本与环境信息</li>
 *     <li>{@code GET /dry_run}：空跑整个 Flow，返回出口状态</li>
 *     <li>{@code GET /topology}：拓扑的 DOT 表示</li>
 *     <li>{@code POST /{endpoint}}：处理单个请求，路径即 exec_endpoint；{@code POST /post} 使用请求体中的端点</li>
 * </ul>
 */
@Slf4j
@RestController
public class GatewayController {

    /** 通用入口：端点取自请求体的 exec_endpoint，缺省为 "/" */
    static final String GENERIC_POST_PATH = "/post";

    private final RequestStreamer streamer;
    private final TopologyGraph graph;
    private final GatewayInfo gatewayInfo;
    private final TargetExecutorMatcher targetMatcher;
    private final DataRequestJsonConverter converter;

    public GatewayController(RequestStreamer streamer,
                             TopologyGraph graph,
                             GatewayInfo gatewayInfo,
                             TargetExecutorMatcher targetMatcher,
                             DataRequestJsonConverter converter) {
        this.streamer = Objects.requireNonNull(streamer, "RequestStreamer 不能为空");
        this.graph = Objects.requireNonNull(graph, "TopologyGraph 不能为空");
        this.gatewayInfo = Objects.requireNonNull(gatewayInfo, "GatewayInfo 不能为空");
        this.targetMatcher = Objects.requireNonNull(targetMatcher, "TargetExecutorMatcher 不能为空");
        this.converter = Objects.requireNonNull(converter, "DataRequestJsonConverter 不能为空");
    }

    @GetMapping("/")
    public Mono<Void> health() {
        return Mono.empty();
    }

    @GetMapping(value = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jina", gatewayInfo.versionInfo());
        body.put("envs", gatewayInfo.envInfo());
        return Mono.just(body);
    }

    @GetMapping(value = "/dry_run", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> dryRun() {
        return streamer.dryRun().map(status -> {
            try {
                return JsonFormat.printer().preservingProtoFieldNames().print(status);
            } catch (InvalidProtocolBufferException e) {
                throw new GatewayException(GatewayErrorCode.INTERNAL, "无法序列化空跑状态: " + e.getMessage(), e);
            }
        });
    }

    @GetMapping(value = "/topology", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<String> topology() {
        return Mono.just(graph.toDot());
    }

    @PostMapping(value = "/**", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ObjectNode> post(ServerHttpRequest request, @RequestBody(required = false) Mono<String> body) {
        String path = request.getPath().pathWithinApplication().value();
        String defaultEndpoint = GENERIC_POST_PATH.equals(path) ? "/" : path;
        return body.defaultIfEmpty("")
                .map(text -> {
                    LazyDataRequest parsed = converter.fromJson(text, defaultEndpoint);
                    targetMatcher.validate(parsed.getTargetExecutor());
                    return parsed;
                })
                .doOnNext(parsed -> log.debug("HTTP 请求进入，路径 '{}'，端点 '{}'", path, parsed.getExecEndpoint()))
                .flatMap(streamer::processSingle)
                .switchIfEmpty(Mono.error(() -> new GatewayException(GatewayErrorCode.CANCELLED, "请求被取消")))
                .map(converter::toJson);
    }
}
