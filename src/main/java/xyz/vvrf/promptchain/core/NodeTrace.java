package xyz.vvrf.promptchain.core;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 单个节点的执行记录，每个已解析、失败或跳过的节点各发出一条。
 * 足以让外部组件重建执行分组以及完整的 prompt/response 轨迹。
 *
 * @author Refactored
 */
@Getter
@Builder
public final class NodeTrace {

    @NonNull private final String nodeName;
    @NonNull private final NodeKind kind;
    private final int levelIndex;
    @NonNull private final NodeResult.NodeStatus status;
    /** 发送给生成能力的替换后文本，仅 DYNAMIC 节点且已完成替换时存在。*/
    private final String prompt;
    private final String value;
    private final Throwable error;
    private final Instant startTime;
    @Builder.Default
    private final Duration duration = Duration.ZERO;

    public Optional<String> prompt() {
        return Optional.ofNullable(prompt);
    }

    public Optional<String> value() {
        return Optional.ofNullable(value);
    }

    public Optional<Throwable> error() {
        return Optional.ofNullable(error);
    }

    public boolean isSuccess() {
        return status == NodeResult.NodeStatus.SUCCESS;
    }

    public boolean isFailure() {
        return status == NodeResult.NodeStatus.FAILURE;
    }

    /**
     * 转换为节点结果。成功记录缺少值时视为空文本。
     */
    public NodeResult toResult() {
        switch (status) {
            case SUCCESS:
                return NodeResult.success(value != null ? value : "");
            case FAILURE:
                return NodeResult.failure(error != null ? error
                        : new IllegalStateException("Node '" + nodeName + "' failed without an error"));
            default:
                return NodeResult.skipped();
        }
    }

    @Override
    public String toString() {
        return String.format("NodeTrace[node=%s, kind=%s, level=%d, status=%s, durationMs=%d%s]",
                nodeName, kind, levelIndex, status, duration.toMillis(),
                error != null ? ", error=" + error.getClass().getSimpleName() : "");
    }
}
