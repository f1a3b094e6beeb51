package xyz.vvrf.reactor.gateway.core;

import xyz.vvrf.reactor.gateway.proto.ExceptionProto;
import xyz.vvrf.reactor.gateway.proto.StatusProto;

import java.util.Arrays;

/**
 * StatusProto 构造与判断工具。
 */
public final class Statuses {

    private static final int MAX_STACK_FRAMES = 20;

    private static final StatusProto SUCCESS = StatusProto.newBuilder()
            .setCode(StatusProto.StatusCode.SUCCESS)
            .build();

    private Statuses() {}

    public static StatusProto success() {
        return SUCCESS;
    }

    public static StatusProto error(String description) {
        return of(StatusProto.StatusCode.ERROR, description);
    }

    public static StatusProto chained(String description) {
        return of(StatusProto.StatusCode.ERROR_CHAINED, description);
    }

    public static StatusProto of(StatusProto.StatusCode code, String description) {
        return StatusProto.newBuilder()
                .setCode(code)
                .setDescription(description != null ? description : "")
                .build();
    }

    /**
     * 根据异常构造 ERROR 状态，附带异常名、消息及截断后的堆栈。
     *
     * @param error    异常
     * @param executor 出错的 executor 名称，网关自身出错时为 "gateway"
     */
    public static StatusProto fromThrowable(Throwable error, String executor) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        ExceptionProto.Builder exception = ExceptionProto.newBuilder()
                .setName(error.getClass().getSimpleName())
                .addArgs(message)
                .setExecutor(executor != null ? executor : "");
        Arrays.stream(error.getStackTrace())
                .limit(MAX_STACK_FRAMES)
                .map(StackTraceElement::toString)
                .forEach(exception::addStacks);
        return StatusProto.newBuilder()
                .setCode(StatusProto.StatusCode.ERROR)
                .setDescription(message)
                .setException(exception)
                .build();
    }

    public static boolean isSuccess(StatusProto status) {
        return status.getCode() == StatusProto.StatusCode.SUCCESS;
    }

    /**
     * PENDING / READY 不视为错误。
     */
    public static boolean isError(StatusProto status) {
        switch (status.getCode()) {
            case ERROR:
            case ERROR_CHAINED:
            case ERROR_NOTALLOWED:
            case RPC_ERROR:
                return true;
            default:
                return false;
        }
    }
}
