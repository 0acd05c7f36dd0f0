package xyz.vvrf.promptchain.core;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 一条提示链的结构定义 (不可变的数据结构)。
 * 由 ChainParser 或 ChainDefinitionBuilder 构建。
 * 不包含保留输入节点；它在依赖图中隐式存在。
 *
 * @author Refactored
 */
public interface ChainDefinition {

    /**
     * 获取链的名称，用于日志和监控。
     */
    String getChainName();

    /**
     * 获取所有用户声明的节点 (Name -> PromptNode)，按声明顺序排列。
     * Map 是不可变的。
     */
    Map<String, PromptNode> getNodes();

    /**
     * 获取指定名称的节点。
     */
    default Optional<PromptNode> getNode(String name) {
        return Optional.ofNullable(getNodes().get(name));
    }

    /**
     * 获取所有节点名称，按声明顺序排列。
     * Set 是不可变的。
     */
    default Set<String> getNodeNames() {
        return getNodes().keySet();
    }

    default boolean containsNode(String name) {
        return getNodes().containsKey(name);
    }

    default boolean hasOutputNode() {
        return containsNode(ChainNames.OUTPUT_NODE_NAME);
    }
}
