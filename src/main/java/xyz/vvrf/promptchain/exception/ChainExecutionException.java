package xyz.vvrf.promptchain.exception;

import lombok.Getter;
import xyz.vvrf.promptchain.core.ExecutionReport;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * 一次运行因节点失败而中止。携带完整的执行报告，其中列出所有失败节点及原因。
 */
@Getter
public class ChainExecutionException extends ChainException {

    private final transient ExecutionReport report;

    public ChainExecutionException(ExecutionReport report) {
        super(buildMessage(report), firstCause(report));
        this.report = report;
    }

    public Map<String, Throwable> getFailures() {
        return report.getFailures();
    }

    private static String buildMessage(ExecutionReport report) {
        String details = report.getFailures().entrySet().stream()
                .map(e -> "[[" + e.getKey() + "]]: " + e.getValue().getMessage())
                .collect(Collectors.joining("; "));
        return String.format("[RequestId: %s][Chain: '%s'] Execution failed with %d failed node(s): %s",
                report.getRequestId(), report.getChainName(), report.getFailures().size(), details);
    }

    private static Throwable firstCause(ExecutionReport report) {
        return report.getFailures().values().stream().findFirst().orElse(null);
    }
}
