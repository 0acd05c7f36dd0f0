package xyz.vvrf.promptchain.core;

import lombok.Getter;

import java.util.Objects;
import java.util.Optional;

/**
 * 代表单个节点解析完成后的结果（不可变数据类）。
 * 包含解析状态、可选的解析值以及可能的错误信息。
 *
 * @author Refactored
 */
public final class NodeResult {

    /**
     * 节点解析状态枚举。
     */
    public enum NodeStatus {
        /** 节点解析成功。必须包含解析值。*/
        SUCCESS,
        /** 节点解析失败。必须包含错误信息。*/
        FAILURE,
        /** 节点从未启动，因为更早的层级已有失败。*/
        SKIPPED
    }

    @Getter private final NodeStatus status;
    private final String value;
    private final Throwable error;

    private NodeResult(NodeStatus status, String value, Throwable error) {
        this.status = Objects.requireNonNull(status, "节点状态不能为空");
        this.value = value;
        this.error = error;

        if (status == NodeStatus.SUCCESS && value == null) {
            throw new IllegalArgumentException("SUCCESS 状态的结果必须包含非 null 的解析值。");
        }
        if (status == NodeStatus.FAILURE && error == null) {
            throw new IllegalArgumentException("FAILURE 状态的结果必须包含一个非空的错误信息。");
        }
        if (status != NodeStatus.FAILURE && error != null) {
            throw new IllegalArgumentException("非 FAILURE 状态的结果不能包含错误信息。");
        }
    }

    public static NodeResult success(String value) {
        return new NodeResult(NodeStatus.SUCCESS, Objects.requireNonNull(value, "解析值不能为空"), null);
    }

    public static NodeResult failure(Throwable error) {
        return new NodeResult(NodeStatus.FAILURE, null, Objects.requireNonNull(error, "错误对象不能为空"));
    }

    public static NodeResult skipped() {
        return new NodeResult(NodeStatus.SKIPPED, null, null);
    }

    public Optional<String> getValue() {
        return Optional.ofNullable(value);
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isSuccess() { return this.status == NodeStatus.SUCCESS; }
    public boolean isFailure() { return this.status == NodeStatus.FAILURE; }
    public boolean isSkipped() { return this.status == NodeStatus.SKIPPED; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeResult that = (NodeResult) o;
        return status == that.status &&
                Objects.equals(value, that.value) &&
                Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, value, error);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("NodeResult{");
        sb.append("status=").append(status);
        // 解析值可能很长，只打印长度
        getValue().ifPresent(v -> sb.append(", valueLength=").append(v.length()));
        getError().ifPresent(e -> sb.append(", error=").append(e.getClass().getSimpleName()));
        sb.append('}');
        return sb.toString();
    }
}
