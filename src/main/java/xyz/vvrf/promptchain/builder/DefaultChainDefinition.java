package xyz.vvrf.promptchain.builder;

import xyz.vvrf.promptchain.core.ChainDefinition;
import xyz.vvrf.promptchain.core.PromptNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ChainDefinition} 的默认不可变实现，由 {@link ChainDefinitionBuilder} 创建。
 */
final class DefaultChainDefinition implements ChainDefinition {

    private final String chainName;
    private final Map<String, PromptNode> nodes;

    DefaultChainDefinition(String chainName, Map<String, PromptNode> nodes) {
        this.chainName = Objects.requireNonNull(chainName, "链名称不能为空");
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(nodes, "节点映射不能为空")));
    }

    @Override
    public String getChainName() {
        return chainName;
    }

    @Override
    public Map<String, PromptNode> getNodes() {
        return nodes;
    }

    @Override
    public String toString() {
        return String.format("ChainDefinition[name=%s, nodes=%s]", chainName, nodes.keySet());
    }
}
