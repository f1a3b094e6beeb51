package xyz.vvrf.reactor.gateway.dispatch;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.gateway.core.HopContext;
import xyz.vvrf.reactor.gateway.core.Partial;

/**
 * 负责把一个请求送到拓扑中的某个节点 (一跳)。
 */
public interface Dispatcher {

    /**
     * 派发到节点 node。
     * <p>
     * 返回的 Mono 总是以一个 Partial 完成：调用失败体现在其状态中，而不是以错误信号结束。
     *
     * @param node    节点 (deployment) 名称
     * @param input   节点的输入
     * @param context 请求级信息 (请求 ID、Flow 名称、截止时间)
     */
    Mono<Partial> dispatch(String node, Partial input, HopContext context);
}
