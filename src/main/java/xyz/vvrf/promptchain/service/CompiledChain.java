package xyz.vvrf.promptchain.service;

import lombok.Getter;
import xyz.vvrf.promptchain.core.ChainDefinition;
import xyz.vvrf.promptchain.graph.DependencyGraph;

import java.util.Objects;

/**
 * 已解析并校验的链：定义和依赖图。不可变，可在多次运行之间复用。
 */
@Getter
public final class CompiledChain {

    private final ChainDefinition definition;
    private final DependencyGraph graph;

    public CompiledChain(ChainDefinition definition, DependencyGraph graph) {
        this.definition = Objects.requireNonNull(definition, "链定义不能为空");
        this.graph = Objects.requireNonNull(graph, "依赖图不能为空");
        if (graph.getDefinition() != definition) {
            throw new IllegalArgumentException("Dependency graph was not built from the given definition.");
        }
    }

    public String getChainName() {
        return definition.getChainName();
    }

    @Override
    public String toString() {
        return "CompiledChain[" + graph + "]";
    }
}
