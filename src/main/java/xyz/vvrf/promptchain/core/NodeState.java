package xyz.vvrf.promptchain.core;

import java.util.EnumSet;
import java.util.Set;

/**
 * 单个节点在一次解析运行中的状态机。
 * <pre>
 * PENDING -> SUBSTITUTING -> RESOLVED                (STATIC)
 * PENDING -> SUBSTITUTING -> GENERATING -> RESOLVED  (DYNAMIC)
 * SUBSTITUTING | GENERATING -> FAILED
 * PENDING -> SKIPPED                                 (从未启动)
 * </pre>
 *
 * @author Refactored
 */
public enum NodeState {
    PENDING,
    SUBSTITUTING,
    GENERATING,
    RESOLVED,
    FAILED,
    SKIPPED;

    public Set<NodeState> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(SUBSTITUTING, SKIPPED);
            case SUBSTITUTING:
                return EnumSet.of(GENERATING, RESOLVED, FAILED);
            case GENERATING:
                return EnumSet.of(RESOLVED, FAILED);
            default:
                return EnumSet.noneOf(NodeState.class);
        }
    }

    public boolean canTransitionTo(NodeState next) {
        return allowedNext().contains(next);
    }
}
