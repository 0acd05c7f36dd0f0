package xyz.vvrf.promptchain.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.promptchain.core.ChainDefinition;
import xyz.vvrf.promptchain.core.ExecutionReport;
import xyz.vvrf.promptchain.execution.ChainResolver;
import xyz.vvrf.promptchain.graph.DependencyGraph;
import xyz.vvrf.promptchain.monitor.ExecutionTraceCollector;
import xyz.vvrf.promptchain.parser.ChainParser;

import java.util.Objects;

/**
 * 提示链的对外入口：解析、校验并运行链文本。
 * 编译结果 (定义 + 依赖图) 按链文本缓存；每次运行的状态不会保留到下一次运行。
 *
 * @author Refactored
 */
@Slf4j
public class PromptChainService {

    private final ChainParser parser;
    private final ChainResolver resolver;
    private final Cache<String, CompiledChain> compiledChains;

    public PromptChainService(ChainParser parser, ChainResolver resolver, long cacheMaximumSize) {
        this.parser = Objects.requireNonNull(parser, "ChainParser 不能为空");
        this.resolver = Objects.requireNonNull(resolver, "ChainResolver 不能为空");
        if (cacheMaximumSize < 0) {
            throw new IllegalArgumentException("Cache maximum size must not be negative.");
        }
        this.compiledChains = Caffeine.newBuilder()
                .maximumSize(cacheMaximumSize)
                .build();
        log.info("PromptChainService initialized. Resolver: {}, Compiled chain cache size: {}",
                resolver.getClass().getSimpleName(), cacheMaximumSize);
    }

    /**
     * 解析并校验链文本。定义错误 (解析、未知引用、循环、缺少 output) 直接抛出，此时不会发生任何生成调用。
     *
     * @param chainText 链文本
     * @return 编译结果
     */
    public CompiledChain compile(String chainText) {
        Objects.requireNonNull(chainText, "链文本不能为空");
        CompiledChain cached = compiledChains.getIfPresent(chainText);
        if (cached != null) {
            log.debug("[Chain: '{}'] Using cached compiled chain.", cached.getChainName());
            return cached;
        }
        ChainDefinition definition = parser.parse(chainText);
        DependencyGraph graph = DependencyGraph.build(definition);
        CompiledChain compiled = new CompiledChain(definition, graph);
        compiledChains.put(chainText, compiled);
        log.debug("[Chain: '{}'] Compiled and cached: {}", compiled.getChainName(), graph);
        return compiled;
    }

    public Mono<ExecutionReport> run(CompiledChain chain, String initialInput, String requestId, ExecutionTraceCollector collector) {
        Objects.requireNonNull(chain, "编译结果不能为空");
        return resolver.resolve(chain.getGraph(), initialInput, requestId, collector);
    }

    /**
     * 编译并运行链文本。定义错误以 Mono 错误信号返回。
     */
    public Mono<ExecutionReport> run(String chainText, String initialInput) {
        return Mono.fromCallable(() -> compile(chainText))
                .flatMap(chain -> run(chain, initialInput, null, null));
    }

    /**
     * 编译并运行链文本，只返回 {@code output} 的值。
     * 节点失败时以 {@link xyz.vvrf.promptchain.exception.ChainExecutionException} 结束。
     */
    public Mono<String> runForOutput(String chainText, String initialInput) {
        return Mono.fromCallable(() -> compile(chainText))
                .flatMap(chain -> resolver.resolveOutput(chain.getGraph(), initialInput));
    }

    public long cachedChainCount() {
        compiledChains.cleanUp();
        return compiledChains.estimatedSize();
    }
}
