package xyz.vvrf.promptchain.core;

/**
 * 节点分类。
 *
 * @author Refactored
 */
public enum NodeKind {
    /** 没有任何引用：文本原样注入，不调用生成能力。保留输入节点总是 STATIC。*/
    STATIC,
    /** 至少一个引用：先替换引用，再把结果文本交给生成能力。*/
    DYNAMIC;

    public static NodeKind of(PromptNode node) {
        return (node.isReserved() || node.getReferences().isEmpty()) ? STATIC : DYNAMIC;
    }
}
