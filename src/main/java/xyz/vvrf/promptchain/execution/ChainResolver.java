package xyz.vvrf.promptchain.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.promptchain.core.ChainDefinition;
import xyz.vvrf.promptchain.core.ExecutionReport;
import xyz.vvrf.promptchain.graph.DependencyGraph;
import xyz.vvrf.promptchain.monitor.ExecutionTraceCollector;

import java.util.Objects;

/**
 * 按层级解析提示链的核心调度器。
 *
 * @author Refactored
 */
public interface ChainResolver {

    /**
     * 解析整条链。层级按深度升序严格依次执行，同一层级的节点并发解析。
     * 节点失败不会使返回的 Mono 出错，而是体现在报告的失败映射中。
     *
     * @param graph        已校验的依赖图
     * @param initialInput 绑定到保留输入节点的文本
     * @param requestId    请求 ID，为空时自动生成
     * @param collector    调用方持有的记录收集器，可为 null；可跨多次运行复用，每次运行的记录都会追加进去
     * @return 执行报告
     */
    Mono<ExecutionReport> resolve(DependencyGraph graph, String initialInput, String requestId, ExecutionTraceCollector collector);

    /**
     * 与 {@link #resolve(DependencyGraph, String, String, ExecutionTraceCollector)} 相同，
     * 但要求依赖图必须由给定的定义构建。
     */
    default Mono<ExecutionReport> resolve(ChainDefinition definition, DependencyGraph graph, String initialInput, String requestId) {
        Objects.requireNonNull(definition, "链定义不能为空");
        Objects.requireNonNull(graph, "依赖图不能为空");
        if (graph.getDefinition() != definition) {
            return Mono.error(new IllegalArgumentException(String.format(
                    "Dependency graph for chain '%s' was not built from the given definition '%s'.",
                    graph.getChainName(), definition.getChainName())));
        }
        return resolve(graph, initialInput, requestId, null);
    }

    default Mono<ExecutionReport> resolve(DependencyGraph graph, String initialInput, String requestId) {
        return resolve(graph, initialInput, requestId, null);
    }

    default Mono<ExecutionReport> resolve(DependencyGraph graph, String initialInput) {
        return resolve(graph, initialInput, null, null);
    }

    /**
     * 解析整条链并只返回 {@code output} 的值。
     * 任一节点失败时以 {@link xyz.vvrf.promptchain.exception.ChainExecutionException} 结束。
     */
    Mono<String> resolveOutput(DependencyGraph graph, String initialInput, String requestId);

    default Mono<String> resolveOutput(DependencyGraph graph, String initialInput) {
        return resolveOutput(graph, initialInput, null);
    }
}
