package xyz.vvrf.promptchain.exception;

/**
 * 提示链框架所有异常的基类。
 *
 * @author Refactored
 */
public abstract class ChainException extends RuntimeException {

    protected ChainException(String message) {
        super(message);
    }

    protected ChainException(String message, Throwable cause) {
        super(message, cause);
    }
}
