package xyz.vvrf.promptchain.exception;

import xyz.vvrf.promptchain.core.ChainNames;

/**
 * 链中没有声明终端节点 {@code [[output]]}。
 */
public class MissingTerminalException extends ChainParseException {

    public MissingTerminalException(String chainName) {
        super(String.format("Chain '%s' must declare an %s node.", chainName,
                ChainNames.placeholder(ChainNames.OUTPUT_NODE_NAME)));
    }
}
