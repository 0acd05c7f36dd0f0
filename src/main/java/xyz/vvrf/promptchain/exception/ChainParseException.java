package xyz.vvrf.promptchain.exception;

/**
 * 链文件格式错误：声明格式不正确、重复声明、声明了保留名称或缺少 output 节点。
 */
public class ChainParseException extends ChainDefinitionException {

    public ChainParseException(String message) {
        super(message);
    }
}
