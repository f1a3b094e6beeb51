package xyz.vvrf.reactor.gateway.lifecycle;

import lombok.extern.slf4j.Slf4j;
import sun.misc.Signal;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 把 SIGINT / SIGTERM 转换为一次性的取消事件，主线程等待该事件后按信号对应的退出码关闭。
 */
@Slf4j
public class GatewaySignalHandler {

    private final CountDownLatch cancelEvent = new CountDownLatch(1);
    private final AtomicInteger exitCode = new AtomicInteger(ExitCodes.OK);

    /**
     * 安装 INT 与 TERM 的处理器。当前平台不支持某个信号时跳过并记录警告。
     */
    public static GatewaySignalHandler install() {
        GatewaySignalHandler handler = new GatewaySignalHandler();
        handler.handle("INT", ExitCodes.SIGINT);
        handler.handle("TERM", ExitCodes.SIGTERM);
        return handler;
    }

    private void handle(String name, int code) {
        try {
            Signal.handle(new Signal(name), signal -> trigger(code));
        } catch (IllegalArgumentException e) {
            log.warn("无法安装 SIG{} 处理器: {}", name, e.getMessage());
        }
    }

    /**
     * 触发取消事件；只有第一次触发决定退出码。
     */
    public void trigger(int code) {
        if (exitCode.compareAndSet(ExitCodes.OK, code)) {
            log.info("收到终止信号，退出码 {}，开始关闭网关", code);
        }
        cancelEvent.countDown();
    }

    /**
     * 阻塞直到收到信号，返回对应的退出码。
     */
    public int awaitSignal() throws InterruptedException {
        cancelEvent.await();
        return exitCode.get();
    }

    public boolean isTriggered() {
        return cancelEvent.getCount() == 0;
    }
}
