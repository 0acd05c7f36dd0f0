package xyz.vvrf.promptchain.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.promptchain.core.ExecutionReport;
import xyz.vvrf.promptchain.core.NodeTrace;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * 只追加的节点执行记录收集器。
 * 由调用方创建并传给解析器，解析器在节点结束时写入记录；运行结束后转换为 {@link ExecutionReport}。
 * 记录可能从多个工作线程并发写入。
 *
 * @author Refactored
 */
@Slf4j
public class ExecutionTraceCollector {

    private final ConcurrentLinkedQueue<NodeTrace> traces = new ConcurrentLinkedQueue<>();
    private final Map<String, Throwable> failures = new LinkedHashMap<>();

    /**
     * 追加一条节点记录。失败记录同时写入失败映射。
     *
     * @param trace 节点记录
     */
    public void record(NodeTrace trace) {
        Objects.requireNonNull(trace, "节点记录不能为空");
        traces.add(trace);
        if (trace.isFailure()) {
            synchronized (failures) {
                failures.putIfAbsent(trace.getNodeName(), trace.error().orElseGet(
                        () -> new IllegalStateException("Node '" + trace.getNodeName() + "' failed without an error")));
            }
        }
        log.trace("Recorded trace: {}", trace);
    }

    public List<NodeTrace> getTraces() {
        return Collections.unmodifiableList(new ArrayList<>(traces));
    }

    public Map<String, Throwable> getFailures() {
        synchronized (failures) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        }
    }

    public boolean hasFailures() {
        synchronized (failures) {
            return !failures.isEmpty();
        }
    }

    public int size() {
        return traces.size();
    }

    public ExecutionReport toReport(String requestId,
                                    String chainName,
                                    List<List<String>> levels,
                                    Instant startTime,
                                    String output) {
        return new ExecutionReport(requestId, chainName, levels, getTraces(), getFailures(),
                startTime, Duration.between(startTime, Instant.now()), output);
    }
}
