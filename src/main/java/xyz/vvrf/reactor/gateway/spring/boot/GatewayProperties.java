package xyz.vvrf.reactor.gateway.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.gateway.codec.CompressionAlgorithm;
import xyz.vvrf.reactor.gateway.topology.FlowDescription;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * 网关配置属性，绑定 'gateway' 前缀。
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "gateway")
@Validated
public class GatewayProperties {

    /**
     * 解析后的 Flow 描述：deployments、出口 needs 等。
     */
    @NotNull
    private FlowDescription flow = new FlowDescription();

    @Valid
    private final Streamer streamer = new Streamer();
    @Valid
    private final Dispatch dispatch = new Dispatch();
    @Valid
    private final Pool pool = new Pool();
    @Valid
    private final SchedulerProps scheduler = new SchedulerProps();
    @Valid
    private final Grpc grpc = new Grpc();

    /**
     * 为 true 时访问日志不记录 GET / 健康检查。
     */
    private boolean disableHealthLogs = false;

    /**
     * 转发给 executor 的工作目录根路径，为空则不发送。
     */
    private String defaultWorkspaceBase;

    @Getter
    @Setter
    public static class Streamer {
        /**
         * 每个客户端流的最大在途请求数，0 表示不限，不得超过 maxPrefetch。
         */
        @Min(0)
        private int prefetch = 0;

        @Min(1)
        private int maxPrefetch = 1000;

        @Min(1)
        private int maxConcurrentStreams = 1024;

        /**
         * 关闭时等待在途请求完成的时长。
         */
        private Duration drain = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Dispatch {
        /**
         * 单次 executor 调用的超时时间。
         */
        private Duration sendTimeout = Duration.ofSeconds(10);

        /**
         * 传输错误的最大重试次数 (不含首次尝试)。
         */
        @Min(0)
        private int maxRetries = 2;

        /**
         * 副本全部不可用时等待其恢复的时长。
         */
        private Duration replicaWait = Duration.ofMillis(500);

        @Min(1)
        private int maxOutstandingPerReplica = 100;

        private CompressionAlgorithm compression = CompressionAlgorithm.NONE;

        /**
         * 是否查询 executor 暴露的端点并跳过不处理当前端点的 deployment。
         */
        private boolean endpointDiscovery = true;

        private Duration discoveryTimeout = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Pool {
        private Duration probeInterval = Duration.ofSeconds(5);
        private Duration probeTimeout = Duration.ofMillis(100);
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(30);

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double backoffJitter = 0.2;
    }

    @Getter
    @Setter
    public static class SchedulerProps {
        /**
         * 合并 (reduce) 使用的调度器类型。
         */
        private SchedulerType type = SchedulerType.PARALLEL;

        private String namePrefix = "gateway-merge";

        @Valid
        private final BoundedElasticProps boundedElastic = new BoundedElasticProps();

        @Valid
        private final ParallelProps parallel = new ParallelProps();

        /**
         * 当 type 为 CUSTOM 时，自定义 Scheduler Bean 的名称。
         */
        private String customBeanName;
    }

    public enum SchedulerType {
        BOUNDED_ELASTIC, PARALLEL, IMMEDIATE, CUSTOM
    }

    @Getter
    @Setter
    public static class BoundedElasticProps {
        @Min(1)
        private int threadCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE;
        @Min(1)
        private int queuedTaskCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE;
        @Min(0)
        private int ttlSeconds = 60;
    }

    @Getter
    @Setter
    public static class ParallelProps {
        @Min(1)
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    @Getter
    @Setter
    public static class Grpc {
        /**
         * 是否启动 gRPC 服务器。HTTP 与 WebSocket 共用 server.port。
         */
        private boolean enabled = true;

        @Min(0)
        @Max(65535)
        private int port = 8081;
    }

    @Override
    public String toString() {
        return "GatewayProperties{" +
                "flow='" + flow.getName() + '\'' +
                ", deployments=" + flow.getDeployments().size() +
                ", streamer={prefetch=" + streamer.prefetch +
                ", maxPrefetch=" + streamer.maxPrefetch +
                ", maxConcurrentStreams=" + streamer.maxConcurrentStreams +
                ", drain=" + streamer.drain +
                "}, dispatch={sendTimeout=" + dispatch.sendTimeout +
                ", maxRetries=" + dispatch.maxRetries +
                ", replicaWait=" + dispatch.replicaWait +
                ", maxOutstandingPerReplica=" + dispatch.maxOutstandingPerReplica +
                ", compression=" + dispatch.compression +
                "}, pool={probeInterval=" + pool.probeInterval +
                ", probeTimeout=" + pool.probeTimeout +
                ", initialBackoff=" + pool.initialBackoff +
                ", maxBackoff=" + pool.maxBackoff +
                ", backoffJitter=" + pool.backoffJitter +
                "}, scheduler={type=" + scheduler.type +
                ", namePrefix='" + scheduler.namePrefix + '\'' +
                "}, grpc={enabled=" + grpc.enabled +
                ", port=" + grpc.port +
                "}, disableHealthLogs=" + disableHealthLogs +
                '}';
    }
}
