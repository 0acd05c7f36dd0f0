package xyz.vvrf.promptchain.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.promptchain.core.NodeKind;
import xyz.vvrf.promptchain.core.NodeResult;
import xyz.vvrf.promptchain.core.NodeState;
import xyz.vvrf.promptchain.core.NodeTrace;
import xyz.vvrf.promptchain.core.PromptNode;
import xyz.vvrf.promptchain.exception.GenerationException;
import xyz.vvrf.promptchain.generation.TextGenerator;
import xyz.vvrf.promptchain.parser.ReferenceTokenizer;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * NodeResolver 的标准实现。
 * STATIC 节点直接使用模板文本 (保留输入节点使用初始输入)，不调用生成能力；
 * DYNAMIC 节点替换所有引用后调用 {@link TextGenerator}，返回值写入记忆表。
 * 任何异常都转换为 FAILURE 记录，返回的 Mono 不会以错误信号结束。
 *
 * @author Refactored
 */
@Slf4j
public class StandardNodeResolver implements NodeResolver {

    private final TextGenerator textGenerator;

    public StandardNodeResolver(TextGenerator textGenerator) {
        this.textGenerator = Objects.requireNonNull(textGenerator, "TextGenerator 不能为空");
        log.info("初始化了 StandardNodeResolver。生成能力: {}", textGenerator.getClass().getSimpleName());
    }

    @Override
    public Mono<NodeTrace> resolveNode(String nodeName, int levelIndex, ChainExecutionContext context) {
        return Mono.fromCallable(() -> resolveInternal(nodeName, levelIndex, context));
    }

    private NodeTrace resolveInternal(String nodeName, int levelIndex, ChainExecutionContext context) {
        final String requestId = context.getRequestId();
        final String chainName = context.getChainName();
        final PromptNode node = context.getGraph().getNode(nodeName)
                .orElseThrow(() -> new IllegalStateException("Node definition disappeared for: " + nodeName));
        final NodeKind kind = node.getKind();
        final Instant startTime = Instant.now();

        context.notifyListeners(l -> l.onNodeStart(requestId, chainName, nodeName, kind, levelIndex));
        context.transition(nodeName, NodeState.SUBSTITUTING);
        log.debug("[RequestId: {}][Chain: '{}'] Resolving node '{}' (Kind: {}, Level: {}) on thread {}",
                requestId, chainName, nodeName, kind, levelIndex, Thread.currentThread().getName());

        String prompt = null;
        try {
            String value;
            if (node.isStatic()) {
                value = node.isReserved() ? context.getInitialInput() : node.getTemplate();
            } else {
                prompt = ReferenceTokenizer.substitute(node.getTemplate(), node.getReferences(), context.getResolvedValues());
                context.transition(nodeName, NodeState.GENERATING);
                value = generate(nodeName, prompt, context);
            }
            context.recordValue(nodeName, value);
            context.transition(nodeName, NodeState.RESOLVED);

            NodeTrace trace = NodeTrace.builder()
                    .nodeName(nodeName)
                    .kind(kind)
                    .levelIndex(levelIndex)
                    .status(NodeResult.NodeStatus.SUCCESS)
                    .prompt(prompt)
                    .value(value)
                    .startTime(startTime)
                    .duration(Duration.between(startTime, Instant.now()))
                    .build();
            context.recordTrace(trace);
            log.debug("[RequestId: {}][Chain: '{}'] Node '{}' resolved in {}ms.",
                    requestId, chainName, nodeName, trace.getDuration().toMillis());
            context.notifyListeners(l -> l.onNodeResolved(requestId, chainName, trace));
            return trace;
        } catch (Exception e) {
            context.transition(nodeName, NodeState.FAILED);
            NodeTrace trace = NodeTrace.builder()
                    .nodeName(nodeName)
                    .kind(kind)
                    .levelIndex(levelIndex)
                    .status(NodeResult.NodeStatus.FAILURE)
                    .prompt(prompt)
                    .error(e)
                    .startTime(startTime)
                    .duration(Duration.between(startTime, Instant.now()))
                    .build();
            context.recordTrace(trace);
            log.error("[RequestId: {}][Chain: '{}'] Node '{}' failed: {}", requestId, chainName, nodeName, e.getMessage());
            context.notifyListeners(l -> l.onNodeFailure(requestId, chainName, trace));
            return trace;
        }
    }

    private String generate(String nodeName, String prompt, ChainExecutionContext context) {
        log.debug("[RequestId: {}][Chain: '{}'] Prompt for node '{}':\n{}",
                context.getRequestId(), context.getChainName(), nodeName, prompt);
        String response;
        try {
            response = textGenerator.generate(prompt);
        } catch (GenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new GenerationException("Generation failed for node '" + nodeName + "': " + e.getMessage(), e);
        }
        if (response == null) {
            throw new GenerationException("Generation returned no text for node '" + nodeName + "'.");
        }
        return response;
    }
}
