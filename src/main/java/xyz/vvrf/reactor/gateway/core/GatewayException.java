package xyz.vvrf.reactor.gateway.core;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import lombok.Getter;

import java.util.Objects;

/**
 * 网关异常基类，携带 {@link GatewayErrorCode}。
 */
@Getter
public class GatewayException extends RuntimeException {

    private final GatewayErrorCode errorCode;

    public GatewayException(GatewayErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "错误码不能为空");
    }

    public GatewayException(GatewayErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "错误码不能为空");
    }

    /**
     * 转换为 gRPC 状态异常，用于 gRPC 前端向客户端返回。
     */
    public StatusRuntimeException toStatusRuntimeException() {
        return Status.fromCode(errorCode.getGrpcCode())
                .withDescription(getMessage())
                .withCause(this)
                .asRuntimeException();
    }

    /**
     * 将任意异常归一为 GatewayException。未知异常归为 INTERNAL。
     */
    public static GatewayException wrap(Throwable error) {
        if (error instanceof GatewayException) {
            return (GatewayException) error;
        }
        return new GatewayException(GatewayErrorCode.INTERNAL,
                error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName(), error);
    }
}
