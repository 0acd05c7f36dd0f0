package xyz.vvrf.promptchain.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.promptchain.core.NodeTrace;

/**
 * 负责解析单个节点的接口。
 * 由 {@link ChainResolver} 在节点所在层级的工作单元中调用。
 *
 * @author Refactored
 */
public interface NodeResolver {

    /**
     * 解析一个节点：替换引用、(DYNAMIC 节点) 调用生成能力并写入记忆表。
     * 返回的 Mono 总是发出一条记录 (成功或失败)，不会以错误信号结束。
     *
     * @param nodeName   节点名称
     * @param levelIndex 节点所在层级
     * @param context    本次运行的上下文
     * @return 节点执行记录
     */
    Mono<NodeTrace> resolveNode(String nodeName, int levelIndex, ChainExecutionContext context);
}
