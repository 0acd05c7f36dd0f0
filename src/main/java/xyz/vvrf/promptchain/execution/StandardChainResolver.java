package xyz.vvrf.promptchain.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.promptchain.core.ChainNames;
import xyz.vvrf.promptchain.core.ExecutionReport;
import xyz.vvrf.promptchain.core.NodeResult;
import xyz.vvrf.promptchain.core.NodeState;
import xyz.vvrf.promptchain.core.NodeTrace;
import xyz.vvrf.promptchain.exception.ChainExecutionException;
import xyz.vvrf.promptchain.generation.TextGenerator;
import xyz.vvrf.promptchain.graph.DependencyGraph;
import xyz.vvrf.promptchain.monitor.ChainMonitorListener;
import xyz.vvrf.promptchain.monitor.ExecutionTraceCollector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * ChainResolver 的标准实现。
 * 层级通过 {@code concatMap} 严格依次执行 (层级屏障)；层级内的节点交给 {@link WorkerPool} 并发解析。
 * 某一层级出现失败后，该层级的其余节点仍会完成，但之后的层级不再启动，其节点记为 SKIPPED。
 * 每个 resolve 调用创建一个 {@link ChainExecutionContext} 来管理其状态。
 *
 * @author Refactored
 */
@Slf4j
public class StandardChainResolver implements ChainResolver {

    private final NodeResolver nodeResolver;
    private final WorkerPool workerPool;
    private final List<ChainMonitorListener> monitorListeners;

    public StandardChainResolver(NodeResolver nodeResolver, WorkerPool workerPool, List<ChainMonitorListener> monitorListeners) {
        this.nodeResolver = Objects.requireNonNull(nodeResolver, "NodeResolver 不能为空");
        this.workerPool = Objects.requireNonNull(workerPool, "WorkerPool 不能为空");
        this.monitorListeners = (monitorListeners != null)
                ? Collections.unmodifiableList(new ArrayList<>(monitorListeners))
                : Collections.emptyList();
        log.info("StandardChainResolver initialized. NodeResolver: {}, Concurrency limit: {}, Listeners: {}",
                nodeResolver.getClass().getSimpleName(), workerPool.getConcurrencyLimit(), this.monitorListeners.size());
    }

    public StandardChainResolver(TextGenerator textGenerator, WorkerPool workerPool) {
        this(new StandardNodeResolver(textGenerator), workerPool, Collections.emptyList());
    }

    @Override
    public Mono<ExecutionReport> resolve(DependencyGraph graph, String initialInput, String requestId, ExecutionTraceCollector collector) {
        Objects.requireNonNull(graph, "依赖图不能为空");
        Objects.requireNonNull(initialInput, "初始输入不能为空");

        return Mono.defer(() -> {
            final ChainExecutionContext context = new ChainExecutionContext(graph, initialInput, requestId, collector, monitorListeners);
            final String actualRequestId = context.getRequestId();
            final String chainName = context.getChainName();

            context.notifyListeners(l -> l.onChainStart(actualRequestId, chainName, graph));
            log.debug("[RequestId: {}][Chain: '{}'] Resolving {} level(s) with concurrency limit {}.",
                    actualRequestId, chainName, graph.getLevelCount(), workerPool.getConcurrencyLimit());

            return Flux.range(0, graph.getLevelCount())
                    .concatMap(levelIndex -> executeLevel(levelIndex, context))
                    .then(Mono.fromCallable(() -> buildReport(context)))
                    .doOnNext(report -> {
                        logCompletion(report);
                        context.notifyListeners(l -> l.onChainComplete(actualRequestId, chainName, report));
                    })
                    .doOnError(e -> log.error("[RequestId: {}][Chain: '{}'] Resolution failed with unexpected error: {}",
                            actualRequestId, chainName, e.getMessage(), e));
        });
    }

    @Override
    public Mono<String> resolveOutput(DependencyGraph graph, String initialInput, String requestId) {
        return resolve(graph, initialInput, requestId, null)
                .flatMap(report -> report.isSuccess()
                        ? Mono.justOrEmpty(report.getOutput())
                        : Mono.error(new ChainExecutionException(report)));
    }

    /**
     * 执行单个层级。如果更早的层级已有失败，则本层级所有节点记为 SKIPPED 且不启动。
     */
    private Mono<Void> executeLevel(int levelIndex, ChainExecutionContext context) {
        return Mono.defer(() -> {
            List<String> level = context.getGraph().getLevels().get(levelIndex);
            if (context.hasFailures()) {
                skipLevel(levelIndex, level, context);
                return Mono.empty();
            }

            context.notifyListeners(l -> l.onLevelStart(context.getRequestId(), context.getChainName(), levelIndex, level));
            log.debug("[RequestId: {}][Chain: '{}'] Dispatching level {} with {} node(s): {}",
                    context.getRequestId(), context.getChainName(), levelIndex, level.size(), level);

            List<Mono<NodeTrace>> units = new ArrayList<>(level.size());
            for (String nodeName : level) {
                units.add(nodeResolver.resolveNode(nodeName, levelIndex, context));
            }
            return workerPool.runAll(units)
                    .doOnNext(traces -> log.debug("[RequestId: {}][Chain: '{}'] Level {} joined. {} node(s) finished, failures so far: {}",
                            context.getRequestId(), context.getChainName(), levelIndex, traces.size(),
                            context.getCollector().getFailures().keySet()))
                    .then();
        });
    }

    private void skipLevel(int levelIndex, List<String> level, ChainExecutionContext context) {
        log.debug("[RequestId: {}][Chain: '{}'] Earlier failure recorded, skipping level {}: {}",
                context.getRequestId(), context.getChainName(), levelIndex, level);
        for (String nodeName : level) {
            context.transition(nodeName, NodeState.SKIPPED);
            NodeTrace trace = NodeTrace.builder()
                    .nodeName(nodeName)
                    .kind(context.getGraph().getKind(nodeName))
                    .levelIndex(levelIndex)
                    .status(NodeResult.NodeStatus.SKIPPED)
                    .build();
            context.recordTrace(trace);
            context.notifyListeners(l -> l.onNodeSkipped(context.getRequestId(), context.getChainName(), trace));
        }
    }

    private ExecutionReport buildReport(ChainExecutionContext context) {
        String output = context.hasFailures() ? null : context.getValue(ChainNames.OUTPUT_NODE_NAME);
        return context.getCollector().toReport(
                context.getRequestId(),
                context.getChainName(),
                context.getGraph().getLevels(),
                context.getStartTime(),
                output);
    }

    private void logCompletion(ExecutionReport report) {
        if (report.isSuccess()) {
            log.info("[RequestId: {}][Chain: '{}'] Execution finished. Final Status: SUCCESS. Levels: {}, Nodes: {}, Duration: {}ms",
                    report.getRequestId(), report.getChainName(), report.getLevels().size(),
                    report.getTraces().size(), report.getTotalDuration().toMillis());
        } else {
            log.warn("[RequestId: {}][Chain: '{}'] Execution finished. Final Status: FAILED. Failed nodes: {}, Duration: {}ms",
                    report.getRequestId(), report.getChainName(), report.getFailures().keySet(),
                    report.getTotalDuration().toMillis());
        }
    }
}
