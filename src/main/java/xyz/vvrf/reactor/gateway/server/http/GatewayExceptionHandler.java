package xyz.vvrf.reactor.gateway.server.http;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;
import xyz.vvrf.reactor.gateway.core.GatewayErrorCode;
import xyz.vvrf.reactor.gateway.core.GatewayException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 将 HTTP 前端的异常转换为 {@code {code, description}} 响应。
 * INTERNAL 错误不向客户端暴露细节，完整堆栈只记录在服务端日志中。
 */
@Slf4j
@RestControllerAdvice(assignableTypes = GatewayController.class)
public class GatewayExceptionHandler {

    static final String REDACTED_DESCRIPTION = "网关内部错误";

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<Map<String, Object>> handleGatewayException(GatewayException e) {
        return toResponse(e);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInputException(ServerWebInputException e) {
        return toResponse(new GatewayException(GatewayErrorCode.BAD_REQUEST, e.getReason() != null ? e.getReason() : "请求无效", e));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        return toResponse(GatewayException.wrap(e));
    }

    private static ResponseEntity<Map<String, Object>> toResponse(GatewayException e) {
        GatewayErrorCode code = e.getErrorCode();
        String description;
        if (code == GatewayErrorCode.INTERNAL) {
            log.error("HTTP 请求处理失败: {}", e.getMessage(), e);
            description = REDACTED_DESCRIPTION;
        } else {
            log.debug("HTTP 请求被拒绝 ({}): {}", code, e.getMessage());
            description = e.getMessage();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", code.name());
        body.put("description", description);
        return ResponseEntity.status(code.getHttpStatus()).body(body);
    }
}
