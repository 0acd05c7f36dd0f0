package xyz.vvrf.promptchain.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * 链中的一个命名模板节点（不可变数据类）。
 * 包含节点名称、原始模板文本、解析期提取的引用列表（去重，保留首次出现顺序）以及保留输入标记。
 *
 * @author Refactored
 */
public final class PromptNode {

    private final String name;
    private final String template;
    private final List<String> references;
    private final boolean reserved;

    /**
     * 创建用户声明的节点。
     *
     * @param name       节点名称 (非空、非空白)
     * @param template   原始模板文本 (非 null)
     * @param references 模板中出现的引用名称 (可包含重复，会被折叠)
     */
    public PromptNode(String name, String template, List<String> references) {
        this(name, template, references, false);
    }

    private PromptNode(String name, String template, List<String> references, boolean reserved) {
        this.name = Objects.requireNonNull(name, "节点名称不能为空");
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("节点名称不能为空白");
        }
        this.template = Objects.requireNonNull(template, "节点 '" + name + "' 的模板不能为 null");
        List<String> refs = (references != null) ? references : Collections.emptyList();
        // 折叠重复项，保留首次出现顺序
        this.references = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(refs)));
        this.reserved = reserved;
    }

    /**
     * 创建保留输入节点。其文本在执行时绑定为调用方提供的初始输入。
     */
    public static PromptNode reservedInput() {
        return new PromptNode(ChainNames.INPUT_NODE_NAME, "", Collections.emptyList(), true);
    }

    public String getName() {
        return name;
    }

    public String getTemplate() {
        return template;
    }

    public List<String> getReferences() {
        return references;
    }

    public boolean isReserved() {
        return reserved;
    }

    public NodeKind getKind() {
        return NodeKind.of(this);
    }

    public boolean isStatic() {
        return getKind() == NodeKind.STATIC;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PromptNode that = (PromptNode) o;
        return reserved == that.reserved &&
                name.equals(that.name) &&
                template.equals(that.template) &&
                references.equals(that.references);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, template, references, reserved);
    }

    @Override
    public String toString() {
        return String.format("PromptNode[name=%s, kind=%s, references=%s%s]",
                name, getKind(), references, reserved ? ", reserved" : "");
    }
}
