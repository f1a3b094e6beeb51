package xyz.vvrf.reactor.gateway.core;

import com.google.protobuf.Timestamp;
import xyz.vvrf.reactor.gateway.proto.RouteProto;
import xyz.vvrf.reactor.gateway.proto.StatusProto;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 路由记录工具。
 * 路由按 (executor, start_time, pod_id) 去重，按 start_time 排序。
 */
public final class Routes {

    public static final String GATEWAY_EXECUTOR = "gateway";

    private static final Comparator<RouteProto> BY_START = Comparator
            .comparingLong((RouteProto r) -> r.getStartTime().getSeconds())
            .thenComparingInt(r -> r.getStartTime().getNanos());

    private Routes() {}

    public static RouteProto start(String executor, String podId, Instant startTime) {
        return RouteProto.newBuilder()
                .setExecutor(executor)
                .setPodId(podId != null ? podId : "")
                .setStartTime(toTimestamp(startTime))
                .build();
    }

    public static RouteProto finish(RouteProto route, Instant endTime, StatusProto status) {
        RouteProto.Builder builder = route.toBuilder().setEndTime(toTimestamp(endTime));
        if (status != null && !Statuses.isSuccess(status)) {
            builder.setStatus(status);
        }
        return builder.build();
    }

    /**
     * 合并多个分支的路由日志。
     */
    public static List<RouteProto> merge(Collection<List<RouteProto>> routeLists) {
        Map<String, RouteProto> unique = new LinkedHashMap<>();
        for (List<RouteProto> routes : routeLists) {
            for (RouteProto route : routes) {
                unique.putIfAbsent(key(route), route);
            }
        }
        List<RouteProto> merged = new ArrayList<>(unique.values());
        merged.sort(BY_START);
        return merged;
    }

    /**
     * 出口路由：请求带进来的路由原样保留在最前，其后是网关路由，再后是本次访问产生的路由
     * (去重并按开始时间排序，已在带入路由中出现的不再重复)。
     */
    public static List<RouteProto> egress(List<RouteProto> carried, RouteProto gateway, List<RouteProto> visited) {
        Set<String> seen = new HashSet<>();
        List<RouteProto> routes = new ArrayList<>(carried.size() + visited.size() + 1);
        for (RouteProto route : carried) {
            seen.add(key(route));
            routes.add(route);
        }
        routes.add(gateway);
        for (RouteProto route : merge(Collections.singletonList(visited))) {
            if (seen.add(key(route))) {
                routes.add(route);
            }
        }
        return routes;
    }

    public static Timestamp toTimestamp(Instant instant) {
        return Timestamp.newBuilder()
                .setSeconds(instant.getEpochSecond())
                .setNanos(instant.getNano())
                .build();
    }

    public static Instant toInstant(Timestamp timestamp) {
        return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
    }

    private static String key(RouteProto route) {
        return route.getExecutor() + '|' + route.getStartTime().getSeconds() + '.' + route.getStartTime().getNanos()
                + '|' + route.getPodId();
    }
}
