package xyz.vvrf.promptchain.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.promptchain.execution.ChainResolver;
import xyz.vvrf.promptchain.execution.NodeResolver;
import xyz.vvrf.promptchain.execution.StandardChainResolver;
import xyz.vvrf.promptchain.execution.StandardNodeResolver;
import xyz.vvrf.promptchain.execution.WorkerPool;
import xyz.vvrf.promptchain.generation.OpenAiTextGenerator;
import xyz.vvrf.promptchain.generation.TextGenerator;
import xyz.vvrf.promptchain.monitor.ChainMonitorListener;
import xyz.vvrf.promptchain.monitor.LoggingChainMonitorListener;
import xyz.vvrf.promptchain.monitor.MicrometerChainMonitorListener;
import xyz.vvrf.promptchain.parser.ChainParser;
import xyz.vvrf.promptchain.report.RunArtifactWriter;
import xyz.vvrf.promptchain.report.TraceLogFormatter;
import xyz.vvrf.promptchain.service.PromptChainService;

import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 提示链的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link PromptChainProperties}。
 * 2. 提供节点执行用的 {@link Scheduler} Bean ("promptChainNodeScheduler") 和 {@link WorkerPool}。
 * 3. 收集所有的 {@link ChainMonitorListener} Bean 到一个列表 Bean ("chainMonitorListeners")。
 * 4. 提供解析器、生成能力、服务和产物写入器。
 * <p>
 * 所有 Bean 都可以通过定义同类型 (或同名) 的 Bean 覆盖，例如提供自己的 {@link TextGenerator}。
 *
 * @author Refactored
 */
@Configuration
@EnableConfigurationProperties(PromptChainProperties.class)
@Slf4j
public class PromptChainAutoConfiguration {

    public PromptChainAutoConfiguration() {
        log.info("提示链自动配置 (PromptChainAutoConfiguration) 已加载。");
    }

    @Bean(name = "promptChainNodeScheduler", destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = "promptChainNodeScheduler")
    public Scheduler promptChainNodeScheduler(PromptChainProperties properties) {
        PromptChainProperties.SchedulerProps props = properties.getScheduler();
        // 线程数不少于并发上限，否则上限永远达不到
        int threadCap = Math.max(props.getThreadCap(), properties.getEngine().effectiveConcurrency());
        log.info("正在创建 'promptChainNodeScheduler' (BoundedElastic): prefix={}, cap={}, queue={}, ttl={}s",
                props.getNamePrefix(), threadCap, props.getQueuedTaskCap(), props.getTtlSeconds());
        return Schedulers.newBoundedElastic(threadCap, props.getQueuedTaskCap(),
                props.getNamePrefix(), props.getTtlSeconds(), true);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerPool promptChainWorkerPool(PromptChainProperties properties,
                                            @Qualifier("promptChainNodeScheduler") Scheduler scheduler) {
        int concurrency = properties.getEngine().effectiveConcurrency();
        log.info("正在创建 WorkerPool: concurrency={} (parallelEnabled={})",
                concurrency, properties.getEngine().isParallelEnabled());
        return new WorkerPool(scheduler, concurrency);
    }

    @Bean
    @ConditionalOnMissingBean(LoggingChainMonitorListener.class)
    public LoggingChainMonitorListener loggingChainMonitorListener() {
        return new LoggingChainMonitorListener();
    }

    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(MicrometerChainMonitorListener.class)
        public MicrometerChainMonitorListener micrometerChainMonitorListener(MeterRegistry meterRegistry) {
            log.info("检测到 MeterRegistry，注册 MicrometerChainMonitorListener。");
            return new MicrometerChainMonitorListener(meterRegistry);
        }
    }

    /**
     * 收集在应用上下文中定义的所有 ChainMonitorListener Bean，作为不可变列表提供。
     */
    @Bean(name = "chainMonitorListeners")
    @ConditionalOnMissingBean(name = "chainMonitorListeners")
    public List<ChainMonitorListener> chainMonitorListeners(ObjectProvider<ChainMonitorListener> listenersProvider) {
        List<ChainMonitorListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 ChainMonitorListener Bean。");
        } else {
            log.info("收集到 {} 个 ChainMonitorListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        return Collections.unmodifiableList(listeners);
    }

    @Bean
    @ConditionalOnMissingBean
    public ChainParser chainParser() {
        return new ChainParser();
    }

    @Bean
    @ConditionalOnMissingBean
    public TextGenerator textGenerator(PromptChainProperties properties, ObjectProvider<WebClient.Builder> webClientBuilder) {
        PromptChainProperties.Generation generation = properties.getGeneration();
        return new OpenAiTextGenerator(
                webClientBuilder.getIfAvailable(WebClient::builder),
                new ObjectMapper(),
                generation.getBaseUrl(),
                generation.getApiKey(),
                generation.getModel(),
                generation.getSystemPrompt(),
                generation.getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public NodeResolver nodeResolver(TextGenerator textGenerator) {
        return new StandardNodeResolver(textGenerator);
    }

    @Bean
    @ConditionalOnMissingBean
    public ChainResolver chainResolver(NodeResolver nodeResolver, WorkerPool workerPool,
                                       @Qualifier("chainMonitorListeners") List<ChainMonitorListener> chainMonitorListeners) {
        return new StandardChainResolver(nodeResolver, workerPool, chainMonitorListeners);
    }

    @Bean
    @ConditionalOnMissingBean
    public PromptChainService promptChainService(ChainParser chainParser, ChainResolver chainResolver,
                                                 PromptChainProperties properties) {
        return new PromptChainService(chainParser, chainResolver, properties.getCache().getMaximumSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public TraceLogFormatter traceLogFormatter() {
        return new TraceLogFormatter();
    }

    @Bean
    @ConditionalOnMissingBean
    public RunArtifactWriter runArtifactWriter(PromptChainProperties properties, TraceLogFormatter traceLogFormatter) {
        return new RunArtifactWriter(Paths.get(properties.getOutput().getDirectory()), traceLogFormatter);
    }
}
