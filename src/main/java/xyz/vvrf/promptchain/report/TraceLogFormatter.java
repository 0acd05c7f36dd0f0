package xyz.vvrf.promptchain.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import xyz.vvrf.promptchain.core.ChainNames;
import xyz.vvrf.promptchain.core.ExecutionReport;
import xyz.vvrf.promptchain.core.NodeKind;
import xyz.vvrf.promptchain.core.NodeTrace;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 将 {@link ExecutionReport} 渲染为人类可读的文本日志或 JSON。
 * 文本日志按层级顺序列出每个步骤：STATIC 步骤显示直接使用的内容，
 * DYNAMIC 步骤显示发送的提示和收到的回复 (失败时显示错误)。
 *
 * @author Refactored
 */
public class TraceLogFormatter {

    static final String STEP_SEPARATOR = "\n\n====================\n\n";

    private final ObjectMapper mapper;

    public TraceLogFormatter() {
        this(new ObjectMapper());
    }

    public TraceLogFormatter(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper 不能为空").copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String format(ExecutionReport report) {
        List<String> entries = new ArrayList<>();
        entries.add(header(report));

        List<String> skipped = new ArrayList<>();
        for (List<String> level : report.getLevels()) {
            for (String name : level) {
                if (ChainNames.isReservedInput(name)) {
                    continue;
                }
                boolean started = report.getResult(name).map(r -> !r.isSkipped()).orElse(false);
                if (!started) {
                    skipped.add(name);
                    continue;
                }
                report.getTrace(name).ifPresent(trace -> entries.add(step(trace)));
            }
        }
        if (!skipped.isEmpty()) {
            StringBuilder sb = new StringBuilder("--- Skipped (not started because an earlier level failed) ---\n\n");
            for (String name : skipped) {
                sb.append(ChainNames.placeholder(name)).append('\n');
            }
            entries.add(sb.toString());
        }
        return String.join(STEP_SEPARATOR, entries);
    }

    private String header(ExecutionReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Prompt chain '").append(report.getChainName()).append("'")
                .append(" (request ").append(report.getRequestId()).append(")\n");
        sb.append("Started: ").append(report.getStartTime()).append('\n');
        sb.append("Duration: ").append(report.getTotalDuration().toMillis()).append(" ms\n");
        sb.append("Status: ").append(report.isSuccess() ? "SUCCESS" : "FAILED").append('\n');
        sb.append("Execution levels:\n");
        for (int i = 0; i < report.getLevels().size(); i++) {
            sb.append("  ").append(i).append(": ").append(report.getLevels().get(i)).append('\n');
        }
        if (!report.isSuccess()) {
            sb.append("Failures:\n");
            report.getFailures().forEach((name, error) ->
                    sb.append("  ").append(ChainNames.placeholder(name)).append(": ").append(error.getMessage()).append('\n'));
        }
        return sb.toString();
    }

    private String step(NodeTrace trace) {
        String name = ChainNames.placeholder(trace.getNodeName());
        if (trace.getKind() == NodeKind.STATIC && trace.isSuccess()) {
            return "--- Step: " + name + " (Static) ---\n\n"
                    + "CONTENT USED DIRECTLY:\n---\n" + trace.value().orElse("") + "\n---\n";
        }
        StringBuilder sb = new StringBuilder("--- Step: ").append(name).append(" ---\n\n");
        trace.prompt().ifPresent(p -> sb.append("PROMPT SENT TO LLM:\n---\n").append(p).append("\n---\n\n"));
        if (trace.isSuccess()) {
            sb.append("RESPONSE RECEIVED:\n---\n").append(trace.value().orElse("")).append("\n---\n");
        } else {
            sb.append("ERROR:\n---\n")
                    .append(trace.error().map(e -> e.getClass().getSimpleName() + ": " + e.getMessage()).orElse("unknown"))
                    .append("\n---\n");
        }
        return sb.toString();
    }

    /**
     * 将报告渲染为 JSON，包含层级、每个节点的记录和失败信息。
     */
    public String toJson(ExecutionReport report) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("requestId", report.getRequestId());
        root.put("chainName", report.getChainName());
        root.put("success", report.isSuccess());
        root.put("startTime", report.getStartTime());
        root.put("durationMs", report.getTotalDuration().toMillis());
        root.put("levels", report.getLevels());

        List<Map<String, Object>> nodes = new ArrayList<>();
        for (NodeTrace trace : report.getTraces()) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("name", trace.getNodeName());
            node.put("kind", trace.getKind());
            node.put("level", trace.getLevelIndex());
            node.put("status", trace.getStatus());
            node.put("durationMs", trace.getDuration().toMillis());
            trace.prompt().ifPresent(p -> node.put("prompt", p));
            trace.value().ifPresent(v -> node.put("value", v));
            trace.error().ifPresent(e -> node.put("error", e.getClass().getSimpleName() + ": " + e.getMessage()));
            nodes.add(node);
        }
        root.put("nodes", nodes);

        Map<String, String> failures = new LinkedHashMap<>();
        report.getFailures().forEach((name, error) -> failures.put(name, error.getMessage()));
        root.put("failures", failures);
        report.getOutput().ifPresent(o -> root.put("output", o));

        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize execution report " + report.getRequestId(), e);
        }
    }
}
