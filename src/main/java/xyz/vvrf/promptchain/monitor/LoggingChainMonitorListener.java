package xyz.vvrf.promptchain.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.promptchain.core.ExecutionReport;
import xyz.vvrf.promptchain.core.NodeKind;
import xyz.vvrf.promptchain.core.NodeTrace;
import xyz.vvrf.promptchain.graph.DependencyGraph;

import java.util.List;

@Slf4j
public class LoggingChainMonitorListener implements ChainMonitorListener {

    @Override
    public void onChainStart(String requestId, String chainName, DependencyGraph graph) {
        log.info("[MONITOR] Request:[{}] Chain:[{}] started. Levels:{}", requestId, chainName, graph.getLevels());
    }

    @Override
    public void onLevelStart(String requestId, String chainName, int levelIndex, List<String> nodeNames) {
        log.info("[MONITOR] Request:[{}] Chain:[{}] Level:[{}] dispatching {} node(s): {}",
                requestId, chainName, levelIndex, nodeNames.size(), nodeNames);
    }

    @Override
    public void onNodeStart(String requestId, String chainName, String nodeName, NodeKind kind, int levelIndex) {
        log.info("[MONITOR] Request:[{}] Chain:[{}] Node:[{}] started. Kind:[{}] Level:[{}]",
                requestId, chainName, nodeName, kind, levelIndex);
    }

    @Override
    public void onNodeResolved(String requestId, String chainName, NodeTrace trace) {
        log.info("[MONITOR] Request:[{}] Chain:[{}] Node:[{}] resolved. Kind:[{}] Duration:[{}ms] ValueLength:[{}]",
                requestId, chainName, trace.getNodeName(), trace.getKind(), trace.getDuration().toMillis(),
                trace.value().map(String::length).orElse(0));
    }

    @Override
    public void onNodeFailure(String requestId, String chainName, NodeTrace trace) {
        log.error("[MONITOR] Request:[{}] Chain:[{}] Node:[{}] failed. Kind:[{}] Duration:[{}ms] Error:[{}]",
                requestId, chainName, trace.getNodeName(), trace.getKind(), trace.getDuration().toMillis(),
                trace.error().map(Throwable::getMessage).orElse("unknown"));
    }

    @Override
    public void onNodeSkipped(String requestId, String chainName, NodeTrace trace) {
        log.info("[MONITOR] Request:[{}] Chain:[{}] Node:[{}] skipped. Level:[{}]",
                requestId, chainName, trace.getNodeName(), trace.getLevelIndex());
    }

    @Override
    public void onChainComplete(String requestId, String chainName, ExecutionReport report) {
        if (report.isSuccess()) {
            log.info("[MONITOR] Request:[{}] Chain:[{}] completed. Duration:[{}ms]",
                    requestId, chainName, report.getTotalDuration().toMillis());
        } else {
            log.warn("[MONITOR] Request:[{}] Chain:[{}] failed. Duration:[{}ms] Failed nodes:{}",
                    requestId, chainName, report.getTotalDuration().toMillis(), report.getFailures().keySet());
        }
    }
}
