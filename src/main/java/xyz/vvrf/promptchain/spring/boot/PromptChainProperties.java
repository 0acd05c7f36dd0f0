package xyz.vvrf.promptchain.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.promptchain.execution.WorkerPool;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * 提示链的配置属性类。
 * 绑定 'prompt-chain' 前缀下的属性。
 *
 * @author Refactored
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "prompt-chain")
@Validated
public class PromptChainProperties {

    @Valid
    private final Engine engine = new Engine();
    @Valid
    private final SchedulerProps scheduler = new SchedulerProps();
    @Valid
    private final Generation generation = new Generation();
    @Valid
    private final Cache cache = new Cache();
    @Valid
    private final Output output = new Output();

    @Getter
    @Setter
    public static class Engine {
        /**
         * 同一层级内同时解析的最大节点数。
         * 默认为可用处理器数量的两倍。
         */
        @Min(1)
        private int concurrencyLevel = WorkerPool.defaultConcurrency();

        /**
         * 是否启用层级内并发。为 false 时并发度固定为 1。
         */
        private boolean parallelEnabled = true;

        public int effectiveConcurrency() {
            return parallelEnabled ? concurrencyLevel : 1;
        }
    }

    @Getter
    @Setter
    public static class SchedulerProps {
        /**
         * 调度器线程名称前缀。
         */
        @NotBlank
        private String namePrefix = "prompt-chain";
        @Min(1)
        private int threadCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE;
        @Min(1)
        private int queuedTaskCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE;
        @Min(0)
        private int ttlSeconds = 60;
    }

    @Getter
    @Setter
    public static class Generation {
        /**
         * OpenAI 兼容接口的基础地址。
         */
        @NotBlank
        private String baseUrl = "https://api.openai.com/v1";

        /**
         * API 密钥。未配置时第一次生成调用会失败。
         */
        private String apiKey;

        @NotBlank
        private String model = "gpt-4o-mini";

        private String systemPrompt = "You are a helpful assistant. Please follow the instructions exactly.";

        /**
         * 单次生成调用的超时时间。
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(120);
    }

    @Getter
    @Setter
    public static class Cache {
        /**
         * 已编译链的缓存容量。
         */
        @Min(0)
        private long maximumSize = 100;
    }

    @Getter
    @Setter
    public static class Output {
        /**
         * 运行产物 (日志与输出文件) 的写入目录。
         */
        @NotBlank
        private String directory = ".";
    }

    @Override
    public String toString() {
        return "PromptChainProperties{" +
                "engine={concurrencyLevel=" + engine.concurrencyLevel +
                ", parallelEnabled=" + engine.parallelEnabled +
                "}, scheduler={namePrefix='" + scheduler.namePrefix + '\'' +
                ", threadCap=" + scheduler.threadCap +
                ", queuedTaskCap=" + scheduler.queuedTaskCap +
                ", ttlSeconds=" + scheduler.ttlSeconds +
                "}, generation={baseUrl='" + generation.baseUrl + '\'' +
                ", apiKeyConfigured=" + (generation.apiKey != null && !generation.apiKey.trim().isEmpty()) +
                ", model='" + generation.model + '\'' +
                ", timeout=" + generation.timeout +
                "}, cache={maximumSize=" + cache.maximumSize +
                "}, output={directory='" + output.directory + '\'' +
                "}}";
    }
}
