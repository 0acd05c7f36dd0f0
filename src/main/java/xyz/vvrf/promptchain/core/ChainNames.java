package xyz.vvrf.promptchain.core;

/**
 * 链定义中的保留节点名称。
 *
 * @author Refactored
 */
public final class ChainNames {

    /**
     * 隐式输入节点，绑定外部提供的初始文本，用户不可声明。
     */
    public static final String INPUT_NODE_NAME = "input text";

    /**
     * 终端节点，其解析值即链的最终输出。
     */
    public static final String OUTPUT_NODE_NAME = "output";

    private ChainNames() {}

    public static boolean isReservedInput(String name) {
        return INPUT_NODE_NAME.equals(name);
    }

    /**
     * 将节点名渲染为模板中的占位符形式，例如 {@code [[summary]]}。
     */
    public static String placeholder(String name) {
        return "[[" + name + "]]";
    }
}
