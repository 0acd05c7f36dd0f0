package xyz.vvrf.promptchain.exception;

/**
 * 外部文本生成调用失败（包括调用方施加的超时）。只影响发起调用的节点及其下游。
 */
public class GenerationException extends ChainException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
