package xyz.vvrf.reactor.gateway.pool;

import io.grpc.Status;
import io.grpc.health.v1.HealthCheckRequest;
import io.grpc.health.v1.HealthCheckResponse;
import io.grpc.health.v1.HealthGrpc;
import io.grpc.stub.StreamObserver;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 通过标准 grpc.health.v1.Health/Check (service = "") 探测副本。
 * 未实现健康服务 (UNIMPLEMENTED) 的 executor 视为可用：连接本身已经建立。
 */
@Slf4j
public class GrpcHealthProbe implements HealthProbe {

    private static final HealthCheckRequest OVERALL = HealthCheckRequest.newBuilder().setService("").build();

    @Override
    public Mono<Boolean> probe(ReplicaConnection replica, Duration timeout) {
        return Mono.create(sink -> HealthGrpc.newStub(replica.getChannel())
                .withDeadlineAfter(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .check(OVERALL, new StreamObserver<HealthCheckResponse>() {
                    @Override
                    public void onNext(HealthCheckResponse response) {
                        sink.success(response.getStatus() == HealthCheckResponse.ServingStatus.SERVING);
                    }

                    @Override
                    public void onError(Throwable t) {
                        Status status = Status.fromThrowable(t);
                        if (status.getCode() == Status.Code.UNIMPLEMENTED) {
                            sink.success(true);
                            return;
                        }
                        log.debug("副本 {} 健康探测失败: {}", replica.getPodId(), status);
                        sink.success(false);
                    }

                    @Override
                    public void onCompleted() {
                        sink.success();
                    }
                }));
    }
}
