package xyz.vvrf.promptchain.generation;

import xyz.vvrf.promptchain.exception.GenerationException;

/**
 * 外部文本生成能力。对解析器而言是同步调用；它会在节点工作线程上阻塞直到返回。
 * 实现必须是线程安全的，同一层级的多个节点会并发调用。
 *
 * @author Refactored
 */
@FunctionalInterface
public interface TextGenerator {

    /**
     * 根据完整的提示文本生成回复。
     *
     * @param prompt 已完成引用替换的提示文本
     * @return 生成的文本 (非 null)
     * @throws GenerationException 调用失败、超时或返回内容无效
     */
    String generate(String prompt) throws GenerationException;
}
