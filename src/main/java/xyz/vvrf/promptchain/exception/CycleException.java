package xyz.vvrf.promptchain.exception;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 依赖图中检测到循环。
 * {@link #getCyclePath()} 给出构成循环的节点序列，首尾为同一个节点，例如 {@code [A, B, A]}。
 */
@Getter
public class CycleException extends ChainDefinitionException {

    private final List<String> cyclePath;

    public CycleException(String chainName, List<String> cyclePath) {
        super(String.format("Chain '%s': circular dependency detected: %s.",
                chainName, String.join(" -> ", cyclePath)));
        this.cyclePath = Collections.unmodifiableList(new ArrayList<>(cyclePath));
    }
}
