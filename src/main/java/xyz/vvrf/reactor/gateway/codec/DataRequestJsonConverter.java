package xyz.vvrf.reactor.gateway.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import xyz.vvrf.reactor.gateway.core.GatewayErrorCode;
import xyz.vvrf.reactor.gateway.core.GatewayException;
import xyz.vvrf.reactor.gateway.core.LazyDataRequest;
import xyz.vvrf.reactor.gateway.proto.DataRequest;

import java.util.Objects;

/**
 * HTTP / WebSocket JSON 模型与 DataRequest 之间的转换。
 * <p>
 * 请求体: {@code {data, parameters, target_executor?, exec_endpoint?, request_id?}}；
 * 响应体: {@code {header, routes, parameters, data}}。字段名沿用 proto 字段名。
 */
public class DataRequestJsonConverter {

    private static final JsonFormat.Parser PARSER = JsonFormat.parser().ignoringUnknownFields();
    private static final JsonFormat.Printer PRINTER = JsonFormat.printer()
            .preservingProtoFieldNames()
            .omittingInsignificantWhitespace();

    private final ObjectMapper objectMapper;

    public DataRequestJsonConverter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper 不能为空");
    }

    /**
     * 解析请求体。
     *
     * @param body            JSON 文本
     * @param defaultEndpoint 请求体未指定 exec_endpoint 时使用的端点 (通常来自 URL 路径)
     * @throws GatewayException BAD_REQUEST，当 body 不是合法 JSON 或字段类型不符
     */
    public LazyDataRequest fromJson(String body, String defaultEndpoint) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null || body.isEmpty() ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new GatewayException(GatewayErrorCode.BAD_REQUEST, "请求体不是合法 JSON: " + e.getOriginalMessage(), e);
        }
        return fromJson(root, defaultEndpoint);
    }

    public LazyDataRequest fromJson(JsonNode root, String defaultEndpoint) {
        if (root == null || !root.isObject()) {
            throw new GatewayException(GatewayErrorCode.BAD_REQUEST, "请求体必须是 JSON 对象");
        }
        ObjectNode message = objectMapper.createObjectNode();
        ObjectNode header = message.putObject("header");
        String endpoint = textOrNull(root, "exec_endpoint");
        message.put("exec_endpoint", endpoint != null ? endpoint : (defaultEndpoint != null ? defaultEndpoint : ""));
        String target = textOrNull(root, "target_executor");
        if (target != null) {
            message.put("target_executor", target);
        }
        String requestId = textOrNull(root, "request_id");
        if (requestId != null) {
            header.put("request_id", requestId);
        }
        if (root.hasNonNull("parameters")) {
            message.set("parameters", root.get("parameters"));
        }
        if (root.hasNonNull("data")) {
            message.set("data", root.get("data"));
        }

        DataRequest.Builder builder = DataRequest.newBuilder();
        try {
            PARSER.merge(objectMapper.writeValueAsString(message), builder);
        } catch (InvalidProtocolBufferException | JsonProcessingException e) {
            throw new GatewayException(GatewayErrorCode.BAD_REQUEST, "请求体字段无效: " + e.getMessage(), e);
        }
        return LazyDataRequest.fromProto(builder.build());
    }

    /**
     * 输出响应模型。
     */
    public ObjectNode toJson(LazyDataRequest request) {
        JsonNode full;
        try {
            full = objectMapper.readTree(PRINTER.print(request.getProto()));
        } catch (InvalidProtocolBufferException | JsonProcessingException e) {
            throw new GatewayException(GatewayErrorCode.INTERNAL, "无法序列化响应: " + e.getMessage(), e);
        }
        ObjectNode response = objectMapper.createObjectNode();
        ObjectNode header = full.has("header") ? (ObjectNode) full.get("header") : objectMapper.createObjectNode();
        // 响应模型中 exec_endpoint / target_executor 放在 header 里
        String endpoint = request.getExecEndpoint();
        if (!endpoint.isEmpty()) {
            header.put("exec_endpoint", endpoint);
        }
        String target = request.getTargetExecutor();
        if (!target.isEmpty()) {
            header.put("target_executor", target);
        }
        response.set("header", header);
        response.set("routes", full.has("routes") ? full.get("routes") : objectMapper.createArrayNode());
        response.set("parameters", full.has("parameters") ? full.get("parameters") : objectMapper.createObjectNode());
        response.set("data", full.has("data") ? full.get("data") : objectMapper.createArrayNode());
        if (full.has("status")) {
            response.set("status", full.get("status"));
        }
        return response;
    }

    public String toJsonString(LazyDataRequest request) {
        try {
            return objectMapper.writeValueAsString(toJson(request));
        } catch (JsonProcessingException e) {
            throw new GatewayException(GatewayErrorCode.INTERNAL, "无法序列化响应: " + e.getMessage(), e);
        }
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new GatewayException(GatewayErrorCode.BAD_REQUEST, "字段 '" + field + "' 必须是字符串");
        }
        return node.asText();
    }
}
