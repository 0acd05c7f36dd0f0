package xyz.vvrf.promptchain.core;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 一次链解析运行的执行报告（不可变）。
 * 交给日志/文件等协作者使用，不属于核心状态。
 *
 * @author Refactored
 */
@Getter
public final class ExecutionReport {

    private final String requestId;
    private final String chainName;
    /** 按深度升序排列的层级，每层为节点名称列表。*/
    private final List<List<String>> levels;
    /** 按发出顺序排列的节点记录。*/
    private final List<NodeTrace> traces;
    /** 失败节点 -> 错误，按记录顺序。*/
    private final Map<String, Throwable> failures;
    private final Instant startTime;
    private final Duration totalDuration;
    private final String output;

    public ExecutionReport(String requestId,
                           String chainName,
                           List<List<String>> levels,
                           List<NodeTrace> traces,
                           Map<String, Throwable> failures,
                           Instant startTime,
                           Duration totalDuration,
                           String output) {
        this.requestId = Objects.requireNonNull(requestId, "请求 ID 不能为空");
        this.chainName = Objects.requireNonNull(chainName, "链名称不能为空");
        List<List<String>> levelCopy = new ArrayList<>();
        for (List<String> level : Objects.requireNonNull(levels, "层级不能为空")) {
            levelCopy.add(Collections.unmodifiableList(new ArrayList<>(level)));
        }
        this.levels = Collections.unmodifiableList(levelCopy);
        this.traces = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(traces, "节点记录不能为空")));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(failures, "失败映射不能为空")));
        this.startTime = Objects.requireNonNull(startTime, "开始时间不能为空");
        this.totalDuration = Objects.requireNonNull(totalDuration, "总耗时不能为空");
        this.output = output;
        if (this.failures.isEmpty() && output == null) {
            throw new IllegalArgumentException("没有失败的运行必须包含 output 的解析值。");
        }
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }

    public Optional<String> getOutput() {
        return Optional.ofNullable(output);
    }

    public Optional<NodeTrace> getTrace(String nodeName) {
        return traces.stream().filter(t -> t.getNodeName().equals(nodeName)).findFirst();
    }

    /**
     * 节点的结果。未被调度的节点 (例如未被 output 引用的节点) 没有结果。
     */
    public Optional<NodeResult> getResult(String nodeName) {
        return getTrace(nodeName).map(NodeTrace::toResult);
    }

    public List<NodeTrace> getTracesForLevel(int levelIndex) {
        List<NodeTrace> result = new ArrayList<>();
        for (NodeTrace trace : traces) {
            if (trace.getLevelIndex() == levelIndex) {
                result.add(trace);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return String.format("ExecutionReport[requestId=%s, chain=%s, success=%s, levels=%d, traces=%d, failures=%s, totalMs=%d]",
                requestId, chainName, isSuccess(), levels.size(), traces.size(), failures.keySet(), totalDuration.toMillis());
    }
}
