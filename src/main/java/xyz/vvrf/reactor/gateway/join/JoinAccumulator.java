package xyz.vvrf.reactor.gateway.join;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.gateway.core.Partial;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Function;

/**
 * 一个汇合节点在一个请求内的 K 个输入槽位。
 * <p>
 * 每个前驱最多填充一次；{@link #drain()} 只能成功调用一次，之后槽位被释放。
 */
@Slf4j
public class JoinAccumulator {

    @Getter private final String node;
    @Getter private final String requestId;
    private final List<String> predecessors;
    private final AtomicReferenceArray<Partial> slots;
    private final AtomicInteger filled = new AtomicInteger(0);
    private final AtomicBoolean drained = new AtomicBoolean(false);

    public JoinAccumulator(String node, List<String> predecessors, String requestId) {
        if (predecessors == null || predecessors.isEmpty()) {
            throw new IllegalArgumentException("汇合节点 '" + node + "' 至少需要一个前驱");
        }
        this.node = node;
        this.requestId = requestId;
        this.predecessors = Collections.unmodifiableList(new ArrayList<>(predecessors));
        this.slots = new AtomicReferenceArray<>(predecessors.size());
    }

    /**
     * 填充前驱对应的槽位。
     *
     * @return 该次填充使全部槽位就绪时返回 true
     */
    public boolean offer(String predecessor, Partial partial) {
        int index = predecessors.indexOf(predecessor);
        if (index < 0) {
            throw new IllegalArgumentException(String.format("'%s' 不是汇合节点 '%s' 的前驱", predecessor, node));
        }
        if (!slots.compareAndSet(index, null, partial)) {
            log.warn("[RequestId: {}] 汇合节点 '{}' 的前驱 '{}' 重复提交结果，已忽略。", requestId, node, predecessor);
            return false;
        }
        return filled.incrementAndGet() == predecessors.size();
    }

    /**
     * 截止时间到达时，用 missing 为尚未到达的前驱生成占位结果。
     */
    public void fillMissing(Function<String, Partial> missing) {
        for (int i = 0; i < predecessors.size(); i++) {
            if (slots.get(i) == null) {
                offer(predecessors.get(i), missing.apply(predecessors.get(i)));
            }
        }
    }

    public boolean isComplete() {
        return filled.get() == predecessors.size();
    }

    public List<String> getMissing() {
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < predecessors.size(); i++) {
            if (slots.get(i) == null) {
                missing.add(predecessors.get(i));
            }
        }
        return missing;
    }

    /**
     * 取出全部槽位 (按前驱声明顺序) 用于合并，并释放槽位。
     *
     * @throws IllegalStateException 如果已经取出过，或仍有槽位未填充
     */
    public List<Partial> drain() {
        if (!isComplete()) {
            throw new IllegalStateException(String.format("汇合节点 '%s' 仍有未到达的前驱: %s", node, getMissing()));
        }
        if (!drained.compareAndSet(false, true)) {
            throw new IllegalStateException(String.format("汇合节点 '%s' (请求 %s) 已经合并过", node, requestId));
        }
        Partial[] result = new Partial[predecessors.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = slots.getAndSet(i, null);
        }
        return Arrays.asList(result);
    }
}
