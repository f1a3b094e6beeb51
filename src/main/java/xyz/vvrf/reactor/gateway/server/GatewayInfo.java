package xyz.vvrf.reactor.gateway.server;

import com.google.protobuf.Message;
import io.grpc.Server;
import xyz.vvrf.reactor.gateway.proto.JinaInfoProto;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * 网关的版本与运行环境信息，供 gRPC _status 与 HTTP /status 使用。
 */
public class GatewayInfo {

    /** 环境信息中报告的环境变量，未设置时显示 (unset) */
    public static final List<String> REPORTED_ENV = Collections.unmodifiableList(Arrays.asList(
            "GATEWAY_LOG_LEVEL",
            "GATEWAY_DISABLE_HEALTH_LOGS",
            "GATEWAY_DEFAULT_WORKSPACE_BASE",
            "GATEWAY_VCS_VERSION"));

    private static final String UNSET = "(unset)";

    private final String flowName;
    private final UnaryOperator<String> env;

    public GatewayInfo(String flowName) {
        this(flowName, System::getenv);
    }

    GatewayInfo(String flowName, UnaryOperator<String> env) {
        this.flowName = Objects.requireNonNull(flowName, "Flow 名称不能为空");
        this.env = env;
    }

    public Map<String, String> versionInfo() {
        Map<String, String> info = new LinkedHashMap<>();
        info.put("gateway", implementationVersion(GatewayInfo.class));
        info.put("flow", flowName);
        info.put("protobuf", implementationVersion(Message.class));
        info.put("grpc", implementationVersion(Server.class));
        info.put("gateway-vcs-tag", valueOrUnset(env.apply("GATEWAY_VCS_VERSION")));
        info.put("java", System.getProperty("java.version", UNSET));
        info.put("java-vendor", System.getProperty("java.vendor", UNSET));
        info.put("platform", System.getProperty("os.name", UNSET));
        info.put("platform-release", System.getProperty("os.version", UNSET));
        info.put("architecture", System.getProperty("os.arch", UNSET));
        info.put("processors", String.valueOf(Runtime.getRuntime().availableProcessors()));
        return info;
    }

    public Map<String, String> envInfo() {
        Map<String, String> envs = new LinkedHashMap<>();
        for (String name : REPORTED_ENV) {
            envs.put(name, valueOrUnset(env.apply(name)));
        }
        return envs;
    }

    public JinaInfoProto toProto() {
        return JinaInfoProto.newBuilder()
                .putAllJina(versionInfo())
                .putAllEnvs(envInfo())
                .build();
    }

    private static String implementationVersion(Class<?> type) {
        Package pkg = type.getPackage();
        String version = pkg != null ? pkg.getImplementationVersion() : null;
        return valueOrUnset(version);
    }

    private static String valueOrUnset(String value) {
        return (value == null || value.isEmpty()) ? UNSET : value;
    }
}
