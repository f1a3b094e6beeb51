package xyz.vvrf.reactor.gateway.core;

/**
 * Flow 描述无法构建为合法拓扑时抛出 (重名、未知依赖、环、分片无端点等)。
 */
public class InvalidTopologyException extends GatewayException {

    public InvalidTopologyException(String message) {
        super(GatewayErrorCode.INVALID_TOPOLOGY, message);
    }
}
