package xyz.vvrf.reactor.gateway.join;

import xyz.vvrf.reactor.gateway.core.Partial;
import xyz.vvrf.reactor.gateway.core.Routes;
import xyz.vvrf.reactor.gateway.core.Statuses;
import xyz.vvrf.reactor.gateway.proto.RouteProto;
import xyz.vvrf.reactor.gateway.proto.StatusProto;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 各合并策略共用的状态与路由合并规则。
 */
final class ReducerSupport {

    private ReducerSupport() {}

    /**
     * 全部成功时为 SUCCESS，否则为 ERROR_CHAINED，描述取第一个失败分支。
     */
    static StatusProto mergeStatus(List<Partial> partials) {
        for (Partial partial : partials) {
            if (!partial.isSuccess()) {
                return Statuses.chained(partial.getStatus().getDescription());
            }
        }
        return Statuses.success();
    }

    static List<RouteProto> mergeRoutes(List<Partial> partials) {
        return Routes.merge(partials.stream().map(Partial::getRoutes).collect(Collectors.toList()));
    }
}
