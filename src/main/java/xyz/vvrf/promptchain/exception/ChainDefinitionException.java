package xyz.vvrf.promptchain.exception;

/**
 * 链定义在执行前即被判定无效。致命错误，不会发生任何生成调用。
 */
public abstract class ChainDefinitionException extends ChainException {

    protected ChainDefinitionException(String message) {
        super(message);
    }
}
