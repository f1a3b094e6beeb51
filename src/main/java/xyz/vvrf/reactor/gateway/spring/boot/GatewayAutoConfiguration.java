package xyz.vvrf.reactor.gateway.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.gateway.codec.DataRequestJsonConverter;
import xyz.vvrf.reactor.gateway.dispatch.DispatchSettings;
import xyz.vvrf.reactor.gateway.dispatch.EndpointDiscovery;
import xyz.vvrf.reactor.gateway.dispatch.Dispatcher;
import xyz.vvrf.reactor.gateway.dispatch.LeaderResolver;
import xyz.vvrf.reactor.gateway.dispatch.StandardDispatcher;
import xyz.vvrf.reactor.gateway.dispatch.StaticLeaderResolver;
import xyz.vvrf.reactor.gateway.dispatch.TargetExecutorMatcher;
import xyz.vvrf.reactor.gateway.join.ConcatDocsReducer;
import xyz.vvrf.reactor.gateway.join.FirstNonEmptyReducer;
import xyz.vvrf.reactor.gateway.join.ReducerExecReducer;
import xyz.vvrf.reactor.gateway.join.ReducerRegistry;
import xyz.vvrf.reactor.gateway.join.RequestReducer;
import xyz.vvrf.reactor.gateway.lifecycle.GatewayLifecycle;
import xyz.vvrf.reactor.gateway.monitor.GatewayMonitorListener;
import xyz.vvrf.reactor.gateway.monitor.LoggingGatewayMonitorListener;
import xyz.vvrf.reactor.gateway.monitor.MicrometerGatewayMonitorListener;
import xyz.vvrf.reactor.gateway.monitor.MonitorNotifier;
import xyz.vvrf.reactor.gateway.pool.ChannelFactory;
import xyz.vvrf.reactor.gateway.pool.ConnectionPool;
import xyz.vvrf.reactor.gateway.pool.ConnectionPoolSettings;
import xyz.vvrf.reactor.gateway.pool.ExecutorClient;
import xyz.vvrf.reactor.gateway.pool.GrpcExecutorClient;
import xyz.vvrf.reactor.gateway.pool.GrpcHealthProbe;
import xyz.vvrf.reactor.gateway.pool.HealthProbe;
import xyz.vvrf.reactor.gateway.pool.NettyChannelFactory;
import xyz.vvrf.reactor.gateway.server.GatewayInfo;
import xyz.vvrf.reactor.gateway.server.grpc.GatewayGrpcServer;
import xyz.vvrf.reactor.gateway.server.grpc.GatewayGrpcService;
import xyz.vvrf.reactor.gateway.server.http.AccessLogWebFilter;
import xyz.vvrf.reactor.gateway.server.http.GatewayController;
import xyz.vvrf.reactor.gateway.server.http.GatewayExceptionHandler;
import xyz.vvrf.reactor.gateway.server.websocket.GatewayWebSocketHandler;
import xyz.vvrf.reactor.gateway.server.websocket.WebSocketSessionRegistry;
import xyz.vvrf.reactor.gateway.server.websocket.WebSocketUpgradeHandlerMapping;
import xyz.vvrf.reactor.gateway.streaming.RequestStreamer;
import xyz.vvrf.reactor.gateway.streaming.StreamerSettings;
import xyz.vvrf.reactor.gateway.streaming.TopologyExecutor;
import xyz.vvrf.reactor.gateway.topology.TopologyGraph;
import xyz.vvrf.reactor.gateway.topology.TopologyGraphBuilder;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 网关的 Spring Boot 自动配置。
 * <p>
 * 由 {@link GatewayProperties} 构建拓扑并装配连接池、派发器、请求流与三个前端 (gRPC、HTTP、WebSocket)。
 * channel 工厂、健康探测、executor 客户端、leader 解析器等均为 {@link ConditionalOnMissingBean}，
 * 测试或嵌入方可以替换。拓扑无效时 {@code topologyGraph} Bean 创建失败，应用无法启动。
 */
@AutoConfiguration(after = {JacksonAutoConfiguration.class, CompositeMeterRegistryAutoConfiguration.class})
@EnableConfigurationProperties(GatewayProperties.class)
@Slf4j
public class GatewayAutoConfiguration {

    private final ApplicationContext applicationContext;

    public GatewayAutoConfiguration(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
        log.info("网关自动配置 (GatewayAutoConfiguration) 已加载。");
    }

    // ---------------------------------------------------------------- 拓扑

    @Bean
    @ConditionalOnMissingBean
    public TopologyGraph topologyGraph(GatewayProperties properties) {
        log.info("正在构建 Flow 拓扑，配置: {}", properties);
        return TopologyGraphBuilder.fromFlow(properties.getFlow());
    }

    // ---------------------------------------------------------------- 连接池

    @Bean
    @ConditionalOnMissingBean
    public ChannelFactory channelFactory() {
        return new NettyChannelFactory();
    }

    @Bean
    @ConditionalOnMissingBean
    public HealthProbe healthProbe() {
        return new GrpcHealthProbe();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutorClient executorClient(GatewayProperties properties) {
        return new GrpcExecutorClient(properties.getDispatch().getCompression(), properties.getDefaultWorkspaceBase());
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectionPool connectionPool(TopologyGraph graph,
                                         ChannelFactory channelFactory,
                                         HealthProbe healthProbe,
                                         GatewayProperties properties) {
        GatewayProperties.Pool pool = properties.getPool();
        GatewayProperties.Dispatch dispatch = properties.getDispatch();
        ConnectionPoolSettings settings = ConnectionPoolSettings.builder()
                .probeInterval(pool.getProbeInterval())
                .probeTimeout(pool.getProbeTimeout())
                .initialBackoff(pool.getInitialBackoff())
                .maxBackoff(pool.getMaxBackoff())
                .backoffJitter(pool.getBackoffJitter())
                .replicaWait(dispatch.getReplicaWait())
                .maxOutstandingPerReplica(dispatch.getMaxOutstandingPerReplica())
                .build();
        return new ConnectionPool(graph, channelFactory, healthProbe, settings);
    }

    // ---------------------------------------------------------------- 合并

    /**
     * 合并 (reduce) 使用的调度器，类型由 {@link GatewayProperties.SchedulerProps} 配置。
     */
    @Bean(name = "gatewayMergeScheduler", destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = "gatewayMergeScheduler")
    public Scheduler gatewayMergeScheduler(GatewayProperties properties) {
        GatewayProperties.SchedulerProps props = properties.getScheduler();
        String namePrefix = props.getNamePrefix();
        switch (props.getType()) {
            case BOUNDED_ELASTIC:
                GatewayProperties.BoundedElasticProps be = props.getBoundedElastic();
                log.info("正在创建 'gatewayMergeScheduler' (BoundedElastic): prefix={}, cap={}, queue={}, ttl={}s",
                        namePrefix, be.getThreadCap(), be.getQueuedTaskCap(), be.getTtlSeconds());
                return Schedulers.newBoundedElastic(be.getThreadCap(), be.getQueuedTaskCap(), namePrefix, be.getTtlSeconds(), true);
            case IMMEDIATE:
                log.info("'gatewayMergeScheduler' 使用 immediate，合并在调用线程上执行");
                return Schedulers.immediate();
            case CUSTOM:
                String customBeanName = props.getCustomBeanName();
                if (customBeanName == null || customBeanName.trim().isEmpty()) {
                    log.error("'gateway.scheduler.type=CUSTOM' 但 'gateway.scheduler.custom-bean-name' 未配置。回退到 Parallel。");
                    return newParallel(props, namePrefix + "-fallback");
                }
                log.info("正在从 Spring 上下文获取自定义合并调度器 Bean，名称: {}", customBeanName);
                return applicationContext.getBean(customBeanName, Scheduler.class);
            case PARALLEL:
            default:
                return newParallel(props, namePrefix);
        }
    }

    private static Scheduler newParallel(GatewayProperties.SchedulerProps props, String namePrefix) {
        int parallelism = props.getParallel().getParallelism();
        log.info("正在创建 'gatewayMergeScheduler' (Parallel): prefix={}, parallelism={}", namePrefix, parallelism);
        return Schedulers.newParallel(namePrefix, parallelism, true);
    }

    @Bean
    public ConcatDocsReducer concatDocsReducer(@Qualifier("gatewayMergeScheduler") Scheduler gatewayMergeScheduler) {
        return new ConcatDocsReducer(gatewayMergeScheduler);
    }

    @Bean
    public FirstNonEmptyReducer firstNonEmptyReducer() {
        return new FirstNonEmptyReducer();
    }

    @Bean
    public ReducerExecReducer reducerExecReducer(ConnectionPool connectionPool,
                                                 ExecutorClient executorClient,
                                                 GatewayProperties properties) {
        return new ReducerExecReducer(connectionPool, executorClient, properties.getDispatch().getSendTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public ReducerRegistry reducerRegistry(ObjectProvider<RequestReducer> reducers) {
        return new ReducerRegistry(reducers.orderedStream().collect(Collectors.toList()));
    }

    // ---------------------------------------------------------------- 监控

    @Bean
    @ConditionalOnMissingBean
    public LoggingGatewayMonitorListener loggingGatewayMonitorListener() {
        return new LoggingGatewayMonitorListener();
    }

    @Bean
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnMissingBean
    public MicrometerGatewayMonitorListener micrometerGatewayMonitorListener(MeterRegistry meterRegistry) {
        return new MicrometerGatewayMonitorListener(meterRegistry);
    }

    /**
     * 收集所有 {@link GatewayMonitorListener} Bean。
     */
    @Bean
    @ConditionalOnMissingBean
    public MonitorNotifier gatewayMonitorNotifier(ObjectProvider<GatewayMonitorListener> listenersProvider) {
        List<GatewayMonitorListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 GatewayMonitorListener Bean。");
        } else {
            log.info("收集到 {} 个 GatewayMonitorListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        return new MonitorNotifier(listeners);
    }

    // ---------------------------------------------------------------- 派发与请求流

    @Bean
    @ConditionalOnMissingBean
    public LeaderResolver leaderResolver(TopologyGraph graph) {
        return new StaticLeaderResolver(graph);
    }

    @Bean
    @ConditionalOnMissingBean
    public TargetExecutorMatcher targetExecutorMatcher() {
        return new TargetExecutorMatcher();
    }

    @Bean
    @ConditionalOnMissingBean
    public EndpointDiscovery endpointDiscovery(ConnectionPool connectionPool,
                                               ExecutorClient executorClient,
                                               GatewayProperties properties) {
        GatewayProperties.Dispatch dispatch = properties.getDispatch();
        return new EndpointDiscovery(connectionPool, executorClient,
                dispatch.getDiscoveryTimeout(), dispatch.isEndpointDiscovery());
    }

    @Bean
    @ConditionalOnMissingBean
    public Dispatcher dispatcher(TopologyGraph graph,
                                 ConnectionPool connectionPool,
                                 ExecutorClient executorClient,
                                 ReducerRegistry reducerRegistry,
                                 LeaderResolver leaderResolver,
                                 TargetExecutorMatcher targetExecutorMatcher,
                                 EndpointDiscovery endpointDiscovery,
                                 GatewayProperties properties,
                                 MonitorNotifier monitor) {
        DispatchSettings settings = DispatchSettings.builder()
                .sendTimeout(properties.getDispatch().getSendTimeout())
                .maxRetries(properties.getDispatch().getMaxRetries())
                .endpointDiscovery(properties.getDispatch().isEndpointDiscovery())
                .discoveryTimeout(properties.getDispatch().getDiscoveryTimeout())
                .build();
        return new StandardDispatcher(graph, connectionPool, executorClient, reducerRegistry,
                leaderResolver, targetExecutorMatcher, endpointDiscovery, settings, monitor);
    }

    @Bean
    @ConditionalOnMissingBean
    public TopologyExecutor topologyExecutor(TopologyGraph graph, Dispatcher dispatcher, ReducerRegistry reducerRegistry) {
        return new TopologyExecutor(graph, dispatcher, reducerRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public RequestStreamer requestStreamer(TopologyExecutor topologyExecutor,
                                           TargetExecutorMatcher targetExecutorMatcher,
                                           GatewayProperties properties,
                                           MonitorNotifier monitor) {
        GatewayProperties.Streamer streamer = properties.getStreamer();
        StreamerSettings settings = StreamerSettings.builder()
                .prefetch(streamer.getPrefetch())
                .maxPrefetch(streamer.getMaxPrefetch())
                .maxConcurrentStreams(streamer.getMaxConcurrentStreams())
                .drain(streamer.getDrain())
                .build();
        return new RequestStreamer(topologyExecutor, targetExecutorMatcher, settings, monitor);
    }

    @Bean
    @ConditionalOnMissingBean
    public GatewayInfo gatewayInfo(TopologyGraph graph) {
        return new GatewayInfo(graph.getName());
    }

    // ---------------------------------------------------------------- gRPC

    @Bean
    @ConditionalOnProperty(prefix = "gateway.grpc", name = "enabled", havingValue = "true", matchIfMissing = true)
    public GatewayGrpcService gatewayGrpcService(RequestStreamer requestStreamer, GatewayInfo gatewayInfo) {
        return new GatewayGrpcService(requestStreamer, gatewayInfo);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "gateway.grpc", name = "enabled", havingValue = "true", matchIfMissing = true)
    public GatewayGrpcServer gatewayGrpcServer(GatewayGrpcService gatewayGrpcService, GatewayProperties properties) {
        return new GatewayGrpcServer(GatewayGrpcServer.netty(properties.getGrpc().getPort()), gatewayGrpcService);
    }

    // ---------------------------------------------------------------- HTTP 与 WebSocket

    @Bean
    @ConditionalOnMissingBean
    public DataRequestJsonConverter dataRequestJsonConverter(ObjectProvider<ObjectMapper> objectMapper) {
        return new DataRequestJsonConverter(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public GatewayController gatewayController(RequestStreamer requestStreamer,
                                               TopologyGraph graph,
                                               GatewayInfo gatewayInfo,
                                               TargetExecutorMatcher targetExecutorMatcher,
                                               DataRequestJsonConverter converter) {
        return new GatewayController(requestStreamer, graph, gatewayInfo, targetExecutorMatcher, converter);
    }

    @Bean
    public GatewayExceptionHandler gatewayExceptionHandler() {
        return new GatewayExceptionHandler();
    }

    @Bean
    public AccessLogWebFilter accessLogWebFilter(GatewayProperties properties) {
        return new AccessLogWebFilter(properties.isDisableHealthLogs());
    }

    @Bean
    public WebSocketSessionRegistry webSocketSessionRegistry() {
        return new WebSocketSessionRegistry();
    }

    @Bean
    public GatewayWebSocketHandler gatewayWebSocketHandler(RequestStreamer requestStreamer,
                                                           DataRequestJsonConverter converter,
                                                           WebSocketSessionRegistry registry) {
        return new GatewayWebSocketHandler(requestStreamer, converter, registry);
    }

    @Bean
    public WebSocketUpgradeHandlerMapping webSocketUpgradeHandlerMapping(GatewayWebSocketHandler handler) {
        return new WebSocketUpgradeHandlerMapping(handler);
    }

    // ---------------------------------------------------------------- 生命周期

    @Bean
    public GatewayLifecycle gatewayLifecycle(ConnectionPool connectionPool,
                                             ObjectProvider<GatewayGrpcServer> grpcServer,
                                             RequestStreamer requestStreamer,
                                             WebSocketSessionRegistry registry) {
        return new GatewayLifecycle(connectionPool, grpcServer.getIfAvailable(), requestStreamer, registry);
    }
}
