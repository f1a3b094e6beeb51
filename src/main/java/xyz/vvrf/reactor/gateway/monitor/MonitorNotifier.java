package xyz.vvrf.reactor.gateway.monitor;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * 向一组监听器广播事件；单个监听器抛出的异常只记录，不影响请求处理。
 */
@Slf4j
public final class MonitorNotifier {

    private static final MonitorNotifier NONE = new MonitorNotifier(Collections.emptyList());

    private final List<GatewayMonitorListener> listeners;

    public MonitorNotifier(List<GatewayMonitorListener> listeners) {
        this.listeners = (listeners != null) ? Collections.unmodifiableList(new ArrayList<>(listeners)) : Collections.emptyList();
    }

    public static MonitorNotifier none() {
        return NONE;
    }

    public void publish(Consumer<GatewayMonitorListener> notification) {
        if (listeners.isEmpty()) {
            return;
        }
        for (GatewayMonitorListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("网关监控监听器 {} 在通知期间抛出异常: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }

    public int size() {
        return listeners.size();
    }
}
