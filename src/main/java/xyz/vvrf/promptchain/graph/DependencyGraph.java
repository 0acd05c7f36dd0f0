package xyz.vvrf.promptchain.graph;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.promptchain.core.ChainDefinition;
import xyz.vvrf.promptchain.core.ChainNames;
import xyz.vvrf.promptchain.core.NodeKind;
import xyz.vvrf.promptchain.core.PromptNode;
import xyz.vvrf.promptchain.exception.ChainParseException;
import xyz.vvrf.promptchain.exception.CycleException;
import xyz.vvrf.promptchain.exception.MissingTerminalException;
import xyz.vvrf.promptchain.exception.UnknownReferenceException;
import xyz.vvrf.promptchain.util.GraphUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 提示链的依赖图 (构建后不可变)。
 * 边 {@code A -> B} 表示 B 引用了 A，A 必须先于 B 完成解析。
 * <p>
 * 构建时完成全部结构校验：未知引用、缺少 output、循环。校验失败时不会有任何生成调用发生。
 * 层级只包含从 output 可达的节点以及保留输入节点；其余未被引用的节点仅被校验，不会被调度。
 *
 * @author Refactored
 */
@Slf4j
public final class DependencyGraph {

    private final ChainDefinition definition;
    private final Map<String, PromptNode> nodes;
    private final Map<String, List<String>> dependencies;
    private final Map<String, List<String>> dependents;
    private final Map<String, Integer> depths;
    private final List<List<String>> levels;
    private final Set<String> deadNodes;

    private DependencyGraph(ChainDefinition definition,
                            Map<String, PromptNode> nodes,
                            Map<String, List<String>> dependencies,
                            Map<String, List<String>> dependents,
                            Map<String, Integer> depths,
                            List<List<String>> levels,
                            Set<String> deadNodes) {
        this.definition = definition;
        this.nodes = nodes;
        this.dependencies = dependencies;
        this.dependents = dependents;
        this.depths = depths;
        this.levels = levels;
        this.deadNodes = deadNodes;
    }

    /**
     * 校验链定义并构建依赖图。
     *
     * @param definition 链定义 (非空)
     * @return 不可变的依赖图
     * @throws MissingTerminalException   没有 output 节点
     * @throws UnknownReferenceException  引用了不存在的节点
     * @throws CycleException             存在循环依赖
     */
    public static DependencyGraph build(ChainDefinition definition) {
        Objects.requireNonNull(definition, "链定义不能为空");
        String chainName = definition.getChainName();
        log.debug("Chain '{}': building dependency graph...", chainName);

        if (!definition.hasOutputNode()) {
            throw new MissingTerminalException(chainName);
        }
        if (definition.containsNode(ChainNames.INPUT_NODE_NAME)) {
            throw new ChainParseException(String.format("Chain '%s': %s is reserved for the initial input and cannot be declared.",
                    chainName, ChainNames.placeholder(ChainNames.INPUT_NODE_NAME)));
        }

        // 保留输入节点放在最前，使其在第 0 层中排第一
        Map<String, PromptNode> nodes = new LinkedHashMap<>();
        nodes.put(ChainNames.INPUT_NODE_NAME, PromptNode.reservedInput());
        nodes.putAll(definition.getNodes());

        Map<String, List<String>> dependencies = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new LinkedHashMap<>();
        for (String name : nodes.keySet()) {
            dependents.put(name, new ArrayList<>());
        }
        for (PromptNode node : nodes.values()) {
            for (String reference : node.getReferences()) {
                if (!nodes.containsKey(reference)) {
                    log.error("Chain '{}': node '{}' references unknown node '{}'.", chainName, node.getName(), reference);
                    throw new UnknownReferenceException(chainName, node.getName(), reference);
                }
                dependents.get(reference).add(node.getName());
            }
            dependencies.put(node.getName(), node.getReferences());
        }

        Map<String, Integer> depths = GraphUtils.computeDepths(dependencies, chainName);

        Set<String> reachable = GraphUtils.collectReachable(ChainNames.OUTPUT_NODE_NAME, dependencies);
        reachable.add(ChainNames.INPUT_NODE_NAME);
        Set<String> deadNodes = new LinkedHashSet<>();
        for (String name : definition.getNodeNames()) {
            if (!reachable.contains(name)) {
                deadNodes.add(name);
            }
        }
        if (!deadNodes.isEmpty()) {
            log.info("Chain '{}': node(s) {} are not referenced by [[output]] and will not be resolved.", chainName, deadNodes);
        }

        int maxDepth = 0;
        for (String name : reachable) {
            maxDepth = Math.max(maxDepth, depths.get(name));
        }
        List<List<String>> levels = new ArrayList<>();
        for (int i = 0; i <= maxDepth; i++) {
            levels.add(new ArrayList<>());
        }
        // 按声明顺序遍历，层内顺序稳定
        for (String name : nodes.keySet()) {
            if (reachable.contains(name)) {
                levels.get(depths.get(name)).add(name);
            }
        }
        List<List<String>> frozenLevels = new ArrayList<>();
        for (List<String> level : levels) {
            frozenLevels.add(Collections.unmodifiableList(level));
        }

        Map<String, List<String>> frozenDependents = new LinkedHashMap<>();
        dependents.forEach((k, v) -> frozenDependents.put(k, Collections.unmodifiableList(v)));

        DependencyGraph graph = new DependencyGraph(
                definition,
                Collections.unmodifiableMap(nodes),
                Collections.unmodifiableMap(dependencies),
                Collections.unmodifiableMap(frozenDependents),
                Collections.unmodifiableMap(depths),
                Collections.unmodifiableList(frozenLevels),
                Collections.unmodifiableSet(deadNodes));

        log.info("Chain '{}': dependency graph built. {} node(s), {} level(s): {}",
                chainName, nodes.size(), frozenLevels.size(), frozenLevels);
        if (log.isDebugEnabled()) {
            log.debug("Chain '{}' DOT representation:\n--- DOT BEGIN ---\n{}\n--- DOT END ---", chainName, graph.toDot());
        }
        return graph;
    }

    public ChainDefinition getDefinition() {
        return definition;
    }

    public String getChainName() {
        return definition.getChainName();
    }

    /**
     * 按深度升序排列的层级，从第 0 层开始。同一层的节点互不依赖。
     */
    public List<List<String>> getLevels() {
        return levels;
    }

    public int getLevelCount() {
        return levels.size();
    }

    /**
     * 获取节点深度。所有已声明节点 (包括未被引用的节点) 以及保留输入都有深度。
     *
     * @throws IllegalArgumentException 节点不存在
     */
    public int getDepth(String name) {
        Integer depth = depths.get(name);
        if (depth == null) {
            throw new IllegalArgumentException("Unknown node: " + name);
        }
        return depth;
    }

    public Map<String, Integer> getDepths() {
        return depths;
    }

    /**
     * 获取节点 (包括保留输入) 的定义。
     */
    public Optional<PromptNode> getNode(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    public List<String> getDependencies(String name) {
        return dependencies.getOrDefault(name, Collections.emptyList());
    }

    public List<String> getDependents(String name) {
        return dependents.getOrDefault(name, Collections.emptyList());
    }

    public NodeKind getKind(String name) {
        return getNode(name).map(PromptNode::getKind)
                .orElseThrow(() -> new IllegalArgumentException("Unknown node: " + name));
    }

    /**
     * 未被 output 直接或间接引用的已声明节点。
     */
    public Set<String> getDeadNodes() {
        return deadNodes;
    }

    public String toDot() {
        return GraphUtils.toDot(getChainName(), dependencies, depths, deadNodes);
    }

    @Override
    public String toString() {
        return String.format("DependencyGraph[chain=%s, levels=%s, dead=%s]", getChainName(), levels, deadNodes);
    }
}
