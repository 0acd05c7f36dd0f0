package xyz.vvrf.promptchain.test.util;

import xyz.vvrf.promptchain.core.ExecutionReport;
import xyz.vvrf.promptchain.core.NodeKind;
import xyz.vvrf.promptchain.core.NodeTrace;
import xyz.vvrf.promptchain.graph.DependencyGraph;
import xyz.vvrf.promptchain.monitor.ChainMonitorListener;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 以字符串形式记录所有监听事件，例如 {@code "resolved:summary"}。
 */
public class RecordingChainMonitorListener implements ChainMonitorListener {

    private final List<String> events = new CopyOnWriteArrayList<>();

    @Override
    public void onChainStart(String requestId, String chainName, DependencyGraph graph) {
        events.add("chainStart:" + chainName);
    }

    @Override
    public void onLevelStart(String requestId, String chainName, int levelIndex, List<String> nodeNames) {
        events.add("level:" + levelIndex);
    }

    @Override
    public void onNodeStart(String requestId, String chainName, String nodeName, NodeKind kind, int levelIndex) {
        events.add("start:" + nodeName);
    }

    @Override
    public void onNodeResolved(String requestId, String chainName, NodeTrace trace) {
        events.add("resolved:" + trace.getNodeName());
    }

    @Override
    public void onNodeFailure(String requestId, String chainName, NodeTrace trace) {
        events.add("failed:" + trace.getNodeName());
    }

    @Override
    public void onNodeSkipped(String requestId, String chainName, NodeTrace trace) {
        events.add("skipped:" + trace.getNodeName());
    }

    @Override
    public void onChainComplete(String requestId, String chainName, ExecutionReport report) {
        events.add("complete:" + report.isSuccess());
    }

    public List<String> getEvents() {
        return new ArrayList<>(events);
    }

    public long count(String prefix) {
        return events.stream().filter(e -> e.startsWith(prefix)).count();
    }
}
