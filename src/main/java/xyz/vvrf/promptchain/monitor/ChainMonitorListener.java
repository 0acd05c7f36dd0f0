package xyz.vvrf.promptchain.monitor;

import xyz.vvrf.promptchain.core.ExecutionReport;
import xyz.vvrf.promptchain.core.NodeKind;
import xyz.vvrf.promptchain.core.NodeTrace;
import xyz.vvrf.promptchain.graph.DependencyGraph;

import java.util.List;

/**
 * 用于监控提示链执行事件的监听器接口。
 * 包括链级别、层级级别和节点级别的事件。
 * 节点事件可能从多个工作线程并发调用，实现必须是线程安全的。
 * 监听器抛出的异常会被记录并忽略，不会影响执行。
 *
 * @author Refactored
 */
public interface ChainMonitorListener {

    /**
     * 链执行开始时调用 (所有校验已通过，尚未调度任何节点)。
     *
     * @param requestId 请求 ID
     * @param chainName 链名称
     * @param graph     已校验的依赖图
     */
    default void onChainStart(String requestId, String chainName, DependencyGraph graph) {
    }

    /**
     * 某一层级开始调度时调用。
     *
     * @param requestId  请求 ID
     * @param chainName  链名称
     * @param levelIndex 层级下标，从 0 开始
     * @param nodeNames  本层级所有节点
     */
    default void onLevelStart(String requestId, String chainName, int levelIndex, List<String> nodeNames) {
    }

    /**
     * 节点开始解析时调用。
     */
    default void onNodeStart(String requestId, String chainName, String nodeName, NodeKind kind, int levelIndex) {
    }

    /**
     * 节点成功解析时调用。
     *
     * @param trace 节点执行记录，包含替换后的提示文本 (DYNAMIC) 和解析值
     */
    default void onNodeResolved(String requestId, String chainName, NodeTrace trace) {
    }

    /**
     * 节点解析失败时调用。
     *
     * @param trace 节点执行记录，包含错误信息
     */
    default void onNodeFailure(String requestId, String chainName, NodeTrace trace) {
    }

    /**
     * 节点因更早的层级失败而从未启动时调用。
     */
    default void onNodeSkipped(String requestId, String chainName, NodeTrace trace) {
    }

    /**
     * 链执行结束时调用 (无论成功或失败)。
     *
     * @param report 完整的执行报告
     */
    default void onChainComplete(String requestId, String chainName, ExecutionReport report) {
    }
}
