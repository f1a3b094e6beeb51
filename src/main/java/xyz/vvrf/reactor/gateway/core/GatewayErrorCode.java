package xyz.vvrf.reactor.gateway.core;

import io.grpc.Status;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 网关错误分类。
 * 每个错误码对应一个 gRPC 状态码和一个 HTTP 状态码，供前端协议映射使用。
 */
@Getter
public enum GatewayErrorCode {

    /** Flow 拓扑无效，构建期错误 */
    INVALID_TOPOLOGY(Status.Code.FAILED_PRECONDITION, HttpStatus.INTERNAL_SERVER_ERROR),
    /** 客户端请求格式错误 (无法解析的 body、非法正则等) */
    BAD_REQUEST(Status.Code.INVALID_ARGUMENT, HttpStatus.BAD_REQUEST),
    /** 目标分片没有 READY 副本 */
    NO_AVAILABLE_REPLICA(Status.Code.UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE),
    /** 请求或单次调用超时 */
    TIMEOUT(Status.Code.DEADLINE_EXCEEDED, HttpStatus.GATEWAY_TIMEOUT),
    /** Executor 返回了应用层错误 */
    EXECUTOR_ERROR(Status.Code.UNKNOWN, HttpStatus.INTERNAL_SERVER_ERROR),
    /** 流数量或副本并发达到上限 */
    RESOURCE_EXHAUSTED(Status.Code.RESOURCE_EXHAUSTED, HttpStatus.TOO_MANY_REQUESTS),
    /** 客户端取消或服务关闭 */
    CANCELLED(Status.Code.CANCELLED, HttpStatus.SERVICE_UNAVAILABLE),
    /** 网关内部错误 */
    INTERNAL(Status.Code.INTERNAL, HttpStatus.INTERNAL_SERVER_ERROR);

    private final Status.Code grpcCode;
    private final HttpStatus httpStatus;

    GatewayErrorCode(Status.Code grpcCode, HttpStatus httpStatus) {
        this.grpcCode = grpcCode;
        this.httpStatus = httpStatus;
    }
}
