package xyz.vvrf.reactor.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.context.ConfigurableApplicationContext;
import xyz.vvrf.reactor.gateway.lifecycle.ExitCodes;
import xyz.vvrf.reactor.gateway.lifecycle.GatewaySignalHandler;

/**
 * 网关进程入口。
 * <p>
 * 启动失败时按原因退出 (拓扑无效 1，端口绑定失败 2)；运行中收到 SIGINT / SIGTERM 后关闭上下文，
 * 以 130 / 143 退出。
 */
@Slf4j
@SpringBootConfiguration
@EnableAutoConfiguration
public class GatewayApplication {

    public static void main(String[] args) {
        GatewaySignalHandler signals = GatewaySignalHandler.install();
        ConfigurableApplicationContext context;
        try {
            context = SpringApplication.run(GatewayApplication.class, args);
        } catch (RuntimeException e) {
            int code = ExitCodes.fromStartupFailure(e);
            log.error("网关启动失败，退出码 {}: {}", code, e.getMessage());
            System.exit(code);
            return;
        }

        int code;
        try {
            code = signals.awaitSignal();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            code = ExitCodes.OK;
        }
        int exitCode = code;
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }
}
