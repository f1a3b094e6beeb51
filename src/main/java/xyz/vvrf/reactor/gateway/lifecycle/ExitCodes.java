package xyz.vvrf.reactor.gateway.lifecycle;

import org.springframework.boot.web.server.PortInUseException;
import xyz.vvrf.reactor.gateway.core.InvalidTopologyException;

import java.net.BindException;

/**
 * 进程退出码。
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int INVALID_TOPOLOGY = 1;
    public static final int BIND_FAILURE = 2;
    public static final int SIGINT = 130;
    public static final int SIGTERM = 143;

    private ExitCodes() {
    }

    /**
     * 沿 cause 链判断启动失败的原因：端口绑定失败为 2，其余 (包括拓扑无效) 为 1。
     */
    public static int fromStartupFailure(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof InvalidTopologyException) {
                return INVALID_TOPOLOGY;
            }
            if (current instanceof BindException || current instanceof PortInUseException) {
                return BIND_FAILURE;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return INVALID_TOPOLOGY;
    }
}
