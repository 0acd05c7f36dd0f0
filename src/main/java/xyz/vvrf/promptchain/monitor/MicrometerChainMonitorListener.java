package xyz.vvrf.promptchain.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.promptchain.core.ExecutionReport;
import xyz.vvrf.promptchain.core.NodeTrace;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

@Slf4j
public class MicrometerChainMonitorListener implements ChainMonitorListener {

    // 指标名称
    static final String METRIC_NODE_EXECUTION_TIME = "prompt.chain.node.execution.time";
    static final String METRIC_NODE_EXECUTION_TOTAL = "prompt.chain.node.execution.total";
    static final String METRIC_CHAIN_EXECUTION_TIME = "prompt.chain.execution.time";

    // 标签键
    private static final String TAG_CHAIN_NAME = "chain.name";
    private static final String TAG_NODE_NAME = "node.name";
    private static final String TAG_KIND = "kind";
    private static final String TAG_STATUS = "status";
    private static final String TAG_ERROR = "error";

    private final MeterRegistry meterRegistry;

    public MicrometerChainMonitorListener(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry 不能为空");
    }

    @Override
    public void onNodeResolved(String requestId, String chainName, NodeTrace trace) {
        Tags tags = nodeTags(chainName, trace);
        recordTimer(METRIC_NODE_EXECUTION_TIME, tags, trace.getDuration().toNanos());
        incrementCounter(tags);
    }

    @Override
    public void onNodeFailure(String requestId, String chainName, NodeTrace trace) {
        Tags tags = nodeTags(chainName, trace)
                .and(TAG_ERROR, trace.error().map(e -> e.getClass().getSimpleName()).orElse("Unknown"));
        recordTimer(METRIC_NODE_EXECUTION_TIME, tags, trace.getDuration().toNanos());
        incrementCounter(tags);
    }

    @Override
    public void onNodeSkipped(String requestId, String chainName, NodeTrace trace) {
        incrementCounter(nodeTags(chainName, trace));
    }

    @Override
    public void onChainComplete(String requestId, String chainName, ExecutionReport report) {
        Tags tags = Tags.of(
                Tag.of(TAG_CHAIN_NAME, chainName),
                Tag.of(TAG_STATUS, report.isSuccess() ? "SUCCESS" : "FAILURE"));
        recordTimer(METRIC_CHAIN_EXECUTION_TIME, tags, report.getTotalDuration().toNanos());
    }

    private Tags nodeTags(String chainName, NodeTrace trace) {
        return Tags.of(
                Tag.of(TAG_CHAIN_NAME, chainName),
                Tag.of(TAG_NODE_NAME, trace.getNodeName()),
                Tag.of(TAG_KIND, trace.getKind().name()),
                Tag.of(TAG_STATUS, trace.getStatus().name()));
    }

    private void recordTimer(String name, Tags tags, long nanos) {
        try {
            Timer.builder(name)
                    .tags(tags)
                    .description("提示链执行时间")
                    .register(meterRegistry)
                    .record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标失败: {}", e.getMessage(), e);
        }
    }

    private void incrementCounter(Tags tags) {
        try {
            Counter.builder(METRIC_NODE_EXECUTION_TOTAL)
                    .tags(tags)
                    .description("按状态统计的节点解析总数")
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            log.error("增加计数器指标失败: {}", e.getMessage(), e);
        }
    }
}
