package xyz.vvrf.reactor.gateway.core;

import lombok.Getter;
import xyz.vvrf.reactor.gateway.proto.RouteProto;
import xyz.vvrf.reactor.gateway.proto.StatusProto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 单个分支在某个节点处的中间结果 (不可变)。
 * <p>
 * 路由记录作为旁路日志随结果一起传递，不写入请求本身，
 * 这样未被修改的请求在各跳之间保持原始字节。出口处统一写入。
 * 旁路日志从请求自带的路由开始，只追加不删除。
 */
@Getter
public final class Partial {

    private final LazyDataRequest request;
    private final List<RouteProto> routes;

    private Partial(LazyDataRequest request, List<RouteProto> routes) {
        this.request = Objects.requireNonNull(request, "请求不能为空");
        this.routes = Collections.unmodifiableList(routes);
    }

    /**
     * 以请求已携带的路由作为旁路日志的起点。
     */
    public static Partial of(LazyDataRequest request) {
        return new Partial(request, new ArrayList<>(request.getRoutes()));
    }

    public static Partial of(LazyDataRequest request, List<RouteProto> routes) {
        return new Partial(request, new ArrayList<>(routes));
    }

    /**
     * 以 base 的请求内容为基础，构造一个带错误状态的结果。
     */
    public static Partial error(Partial base, StatusProto status) {
        Objects.requireNonNull(status, "状态不能为空");
        return new Partial(base.request.mutate(b -> b.setStatus(status)), new ArrayList<>(base.routes));
    }

    public Partial withRoute(RouteProto route) {
        List<RouteProto> next = new ArrayList<>(routes.size() + 1);
        next.addAll(routes);
        next.add(route);
        return new Partial(request, next);
    }

    public Partial withRequest(LazyDataRequest newRequest) {
        return new Partial(newRequest, new ArrayList<>(routes));
    }

    public StatusProto getStatus() {
        return request.getStatus();
    }

    public boolean isSuccess() {
        return Statuses.isSuccess(getStatus());
    }

    public boolean isError() {
        return Statuses.isError(getStatus());
    }

    @Override
    public String toString() {
        return "Partial{" +
                "request=" + request +
                ", routes=" + routes.size() +
                '}';
    }
}
