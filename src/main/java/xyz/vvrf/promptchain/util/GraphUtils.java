package xyz.vvrf.promptchain.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.promptchain.exception.CycleException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 提供依赖图深度计算、循环检测、可达性分析和 DOT 渲染的工具方法。
 * 所有方法都基于 "节点 -> 其依赖列表" 形式的邻接表，不使用递归。
 *
 * @author Refactored
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {}

    /**
     * 三色标记：WHITE 未访问，GRAY 正在计算 (位于当前路径上)，BLACK 已完成。
     */
    private enum Color { WHITE, GRAY, BLACK }

    /**
     * 显式工作栈中的一帧：节点及其下一个待访问依赖的下标。
     */
    private static final class Frame {
        final String node;
        int next;

        Frame(String node) {
            this.node = node;
        }
    }

    /**
     * 使用显式工作栈的深度优先遍历计算每个节点的深度。
     * 没有依赖的节点深度为 0，否则为 1 + 所有依赖的最大深度。
     * 计算过程中再次遇到 GRAY 节点即表示存在循环。
     *
     * @param dependencies 节点 -> 依赖列表；所有依赖都必须是 Map 中的键
     * @param graphName    用于日志和异常信息的名称
     * @return 节点 -> 深度，迭代顺序与输入一致
     * @throws CycleException 如果检测到循环
     */
    public static Map<String, Integer> computeDepths(Map<String, List<String>> dependencies, String graphName) {
        log.debug("Chain '{}': computing node depths for {} node(s)...", graphName, dependencies.size());
        Map<String, Color> colors = new HashMap<>();
        Map<String, Integer> depths = new HashMap<>();

        for (String start : dependencies.keySet()) {
            if (colors.getOrDefault(start, Color.WHITE) != Color.WHITE) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(start));
            colors.put(start, Color.GRAY);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                List<String> deps = dependencies.getOrDefault(frame.node, Collections.emptyList());
                if (frame.next < deps.size()) {
                    String dep = deps.get(frame.next++);
                    Color color = colors.getOrDefault(dep, Color.WHITE);
                    if (color == Color.GRAY) {
                        List<String> cycle = extractCyclePath(stack, dep);
                        log.debug("Chain '{}': cycle detected: {}", graphName, cycle);
                        throw new CycleException(graphName, cycle);
                    }
                    if (color == Color.WHITE) {
                        colors.put(dep, Color.GRAY);
                        stack.push(new Frame(dep));
                    }
                } else {
                    int depth = 0;
                    for (String dep : deps) {
                        depth = Math.max(depth, depths.get(dep) + 1);
                    }
                    depths.put(frame.node, depth);
                    colors.put(frame.node, Color.BLACK);
                    stack.pop();
                }
            }
        }

        Map<String, Integer> ordered = new LinkedHashMap<>();
        for (String node : dependencies.keySet()) {
            ordered.put(node, depths.get(node));
        }
        log.debug("Chain '{}': node depths computed: {}", graphName, ordered);
        return ordered;
    }

    // 栈顶是当前路径末端；从栈底开始找到 GRAY 依赖所在位置，截取到栈顶并闭合
    private static List<String> extractCyclePath(Deque<Frame> stack, String reentered) {
        List<String> path = new ArrayList<>();
        Iterator<Frame> fromBottom = stack.descendingIterator();
        boolean inCycle = false;
        while (fromBottom.hasNext()) {
            String node = fromBottom.next().node;
            if (node.equals(reentered)) {
                inCycle = true;
            }
            if (inCycle) {
                path.add(node);
            }
        }
        path.add(reentered);
        return path;
    }

    /**
     * 从给定起点出发，沿依赖边收集所有可达节点 (含起点)。
     */
    public static Set<String> collectReachable(String root, Map<String, List<String>> dependencies) {
        Set<String> reachable = new LinkedHashSet<>();
        Deque<String> worklist = new ArrayDeque<>();
        worklist.add(root);
        while (!worklist.isEmpty()) {
            String node = worklist.poll();
            if (reachable.add(node)) {
                worklist.addAll(dependencies.getOrDefault(node, Collections.emptyList()));
            }
        }
        return reachable;
    }

    /**
     * 将依赖图渲染为 Graphviz DOT 代码。边方向为 依赖 -> 依赖者。
     *
     * @param graphName    图名称
     * @param dependencies 节点 -> 依赖列表
     * @param levels       节点 -> 层级下标，用于标签；可为空 Map
     * @param highlighted  需要以虚线框标注的节点 (例如未被引用的节点)
     */
    public static String toDot(String graphName,
                               Map<String, List<String>> dependencies,
                               Map<String, Integer> levels,
                               Collection<String> highlighted) {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph \"").append(escape(graphName)).append("\" {\n");
        dot.append("  rankdir=LR;\n");
        dot.append("  node [shape=box, style=rounded];\n");
        for (String node : dependencies.keySet()) {
            dot.append("  \"").append(escape(node)).append("\"");
            Integer level = levels.get(node);
            StringBuilder attrs = new StringBuilder();
            if (level != null) {
                attrs.append("label=\"").append(escape(node)).append("\\nL").append(level).append("\"");
            }
            if (highlighted.contains(node)) {
                if (attrs.length() > 0) attrs.append(", ");
                attrs.append("style=dashed");
            }
            if (attrs.length() > 0) {
                dot.append(" [").append(attrs).append("]");
            }
            dot.append(";\n");
        }
        for (Map.Entry<String, List<String>> entry : dependencies.entrySet()) {
            for (String dep : entry.getValue()) {
                dot.append("  \"").append(escape(dep)).append("\" -> \"").append(escape(entry.getKey())).append("\";\n");
            }
        }
        dot.append("}");
        return dot.toString();
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
