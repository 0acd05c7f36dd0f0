package xyz.vvrf.promptchain.execution;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.promptchain.core.NodeState;
import xyz.vvrf.promptchain.core.NodeTrace;
import xyz.vvrf.promptchain.graph.DependencyGraph;
import xyz.vvrf.promptchain.monitor.ChainMonitorListener;
import xyz.vvrf.promptchain.monitor.ExecutionTraceCollector;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * 封装单次链解析运行的上下文和运行时状态。
 * 每个 {@link ChainResolver#resolve} 调用都会创建一个此类的实例，运行之间不共享任何状态。
 *
 * @author Refactored
 */
@Slf4j
@Getter
public class ChainExecutionContext {

    private final String requestId;
    private final DependencyGraph graph;
    private final String chainName;
    private final String initialInput;
    private final Instant startTime;
    /** 本次运行自己的记录，失败检测和报告只依赖它。*/
    private final ExecutionTraceCollector collector;
    /** 调用方提供的收集器，可能跨多次运行复用，只接收转发的记录。*/
    @Getter(AccessLevel.NONE)
    private final ExecutionTraceCollector externalCollector;
    private final List<ChainMonitorListener> listeners;

    /** 记忆表：节点名 -> 解析值，每个节点只写入一次。*/
    private final Map<String, String> resolvedValues = new ConcurrentHashMap<>();
    private final Map<String, NodeState> states = new ConcurrentHashMap<>();

    public ChainExecutionContext(DependencyGraph graph,
                                 String initialInput,
                                 String rawRequestId,
                                 ExecutionTraceCollector collector,
                                 List<ChainMonitorListener> listeners) {
        this.graph = Objects.requireNonNull(graph, "依赖图不能为空");
        this.initialInput = Objects.requireNonNull(initialInput, "初始输入不能为空");
        this.collector = new ExecutionTraceCollector();
        this.externalCollector = collector;
        this.listeners = (listeners != null)
                ? Collections.unmodifiableList(new ArrayList<>(listeners))
                : Collections.emptyList();
        this.chainName = graph.getChainName();
        this.startTime = Instant.now();
        this.requestId = (rawRequestId != null && !rawRequestId.trim().isEmpty())
                ? rawRequestId
                : "chain-req-" + UUID.randomUUID().toString().substring(0, 8);

        for (List<String> level : graph.getLevels()) {
            for (String name : level) {
                states.put(name, NodeState.PENDING);
            }
        }

        log.info("[RequestId: {}][Chain: '{}'] 创建 ChainExecutionContext (Levels: {}, Nodes: {}, Listeners: {})",
                this.requestId, this.chainName, graph.getLevelCount(), states.size(), this.listeners.size());
    }

    /**
     * 记录一个节点的解析值。每个节点只能写入一次。
     *
     * @throws IllegalStateException 该节点已有解析值
     */
    public void recordValue(String nodeName, String value) {
        Objects.requireNonNull(value, "解析值不能为空");
        String previous = resolvedValues.putIfAbsent(nodeName, value);
        if (previous != null) {
            throw new IllegalStateException(String.format(
                    "[RequestId: %s][Chain: '%s'] Node '%s' already has a resolved value; refusing second write.",
                    requestId, chainName, nodeName));
        }
        log.debug("[RequestId: {}][Chain: '{}'] Node '{}' value recorded ({} characters). Progress: {}/{}",
                requestId, chainName, nodeName, value.length(), resolvedValues.size(), states.size());
    }

    public String getValue(String nodeName) {
        return resolvedValues.get(nodeName);
    }

    public Map<String, String> getResolvedValues() {
        return Collections.unmodifiableMap(resolvedValues);
    }

    /**
     * 将节点迁移到下一个状态。
     *
     * @throws IllegalStateException 非法的状态迁移
     */
    public void transition(String nodeName, NodeState next) {
        states.compute(nodeName, (name, current) -> {
            if (current == null) {
                throw new IllegalStateException(String.format(
                        "[RequestId: %s][Chain: '%s'] Node '%s' is not scheduled in this run.", requestId, chainName, name));
            }
            if (!current.canTransitionTo(next)) {
                throw new IllegalStateException(String.format(
                        "[RequestId: %s][Chain: '%s'] Illegal state transition for node '%s': %s -> %s",
                        requestId, chainName, name, current, next));
            }
            log.trace("[RequestId: {}][Chain: '{}'] Node '{}' {} -> {}", requestId, chainName, name, current, next);
            return next;
        });
    }

    public NodeState getState(String nodeName) {
        return states.get(nodeName);
    }

    public Map<String, NodeState> getStates() {
        return Collections.unmodifiableMap(states);
    }

    public void recordTrace(NodeTrace trace) {
        collector.record(trace);
        if (externalCollector != null) {
            externalCollector.record(trace);
        }
    }

    public boolean hasFailures() {
        return collector.hasFailures();
    }

    /**
     * 依次通知所有监听器。监听器抛出的异常被记录后忽略。
     */
    public void notifyListeners(Consumer<ChainMonitorListener> notification) {
        if (listeners.isEmpty()) {
            return;
        }
        for (ChainMonitorListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("[RequestId: {}][Chain: '{}'] 链监控监听器 {} 在通知期间抛出异常: {}",
                        requestId, chainName, listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
