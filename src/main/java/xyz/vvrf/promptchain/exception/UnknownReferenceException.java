package xyz.vvrf.promptchain.exception;

import lombok.Getter;
import xyz.vvrf.promptchain.core.ChainNames;

/**
 * 某节点引用了既未声明、也不是保留输入的名称。
 */
@Getter
public class UnknownReferenceException extends ChainDefinitionException {

    private final String nodeName;
    private final String reference;

    public UnknownReferenceException(String chainName, String nodeName, String reference) {
        super(String.format("Chain '%s': node %s references unknown node %s.",
                chainName, ChainNames.placeholder(nodeName), ChainNames.placeholder(reference)));
        this.nodeName = nodeName;
        this.reference = reference;
    }
}
