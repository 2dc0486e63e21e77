package xyz.vvrf.reactor.agent.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import reactor.core.scheduler.Schedulers;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * Agent 框架的配置属性类，绑定 'agent' 前缀下的属性。
 *
 * @author ruifeng.wen
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "agent")
@Validated
public class AgentFrameworkProperties {

    @Valid
    private final Engine engine = new Engine();
    @Valid
    private final SchedulerProps scheduler = new SchedulerProps();
    @Valid
    private final Dispatcher dispatcher = new Dispatcher();
    @Valid
    private final Providers providers = new Providers();
    @Valid
    private final Checkpoint checkpoint = new Checkpoint();
    @Valid
    private final Session session = new Session();

    @Getter
    @Setter
    public static class Engine {
        /**
         * 节点的默认执行超时时间。节点自身或图中的实例可以覆盖。
         */
        @NotNull
        private Duration nodeTimeout = Duration.ofSeconds(120);

        /**
         * 单次运行允许执行的最大节点步数，防止路由环无限循环。
         */
        @Min(1)
        private int maxSteps = 32;
    }

    @Getter
    @Setter
    public static class SchedulerProps {
        /**
         * 调度器类型。
         */
        private SchedulerType type = SchedulerType.BOUNDED_ELASTIC;

        /**
         * 调度器名称前缀。
         */
        private String namePrefix = "agent-exec";

        @Valid
        private final BoundedElasticProps boundedElastic = new BoundedElasticProps();

        @Valid
        private final ParallelProps parallel = new ParallelProps();

        /**
         * 当 type 为 CUSTOM 时，自定义 Scheduler Bean 的名称。
         */
        private String customBeanName;
    }

    public enum SchedulerType {
        BOUNDED_ELASTIC, PARALLEL, SINGLE, CUSTOM
    }

    @Getter
    @Setter
    public static class BoundedElasticProps {
        @Min(1)
        private int threadCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE;
        @Min(1)
        private int queuedTaskCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE;
        @Min(0)
        private int ttlSeconds = 60;
    }

    @Getter
    @Setter
    public static class ParallelProps {
        @Min(1)
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    @Getter
    @Setter
    public static class Dispatcher {
        /**
         * 每个提供方的最大尝试次数 (包括第一次)。
         */
        @Min(1)
        private int maxAttempts = 3;

        /**
         * 第一次重试前的退避延迟，之后每次翻倍。
         */
        @NotNull
        private Duration baseDelay = Duration.ofMillis(500);

        @NotNull
        private Duration maxDelay = Duration.ofSeconds(8);

        /**
         * 抖动因子，最多缩短退避延迟的 20%。
         */
        @DecimalMin("0.0")
        @DecimalMax("0.2")
        private double jitterFactor = 0.2;

        @Valid
        private final Cache cache = new Cache();
    }

    @Getter
    @Setter
    public static class Cache {
        private boolean enabled = true;
        @NotNull
        private Duration ttl = Duration.ofHours(6);
        @Min(1)
        private long maxSize = 10_000;
    }

    @Getter
    @Setter
    public static class Providers {
        @Valid
        private final Provider primary = new Provider("anthropic", "https://api.anthropic.com", "claude-3-5-sonnet-20241022");
        @Valid
        private final Provider fallback = new Provider("openai", "https://api.openai.com", "gpt-4o-mini");
        @Valid
        private final Provider local = new Provider("ollama", "http://localhost:11434", "llama3.1");
    }

    @Getter
    @Setter
    public static class Provider {
        private boolean enabled = true;
        private String name;
        private String baseUrl;
        private String apiKey;
        private String model;
        @NotNull
        private Duration timeout = Duration.ofSeconds(60);

        public Provider() {
        }

        Provider(String name, String baseUrl, String model) {
            this.name = name;
            this.baseUrl = baseUrl;
            this.model = model;
        }
    }

    @Getter
    @Setter
    public static class Checkpoint {
        @NotNull
        private Duration ttl = Duration.ofHours(2);
        @Min(1)
        private long maxSize = 10_000;
    }

    @Getter
    @Setter
    public static class Session {
        /**
         * 会话状态 (代数、事件通道、对话记录和难度等级) 在最后一次访问后的保留时间。
         */
        @NotNull
        private Duration ttl = Duration.ofHours(2);

        @Min(1)
        private long maxSessions = 10_000;
    }

    @Override
    public String toString() {
        return "AgentFrameworkProperties{" +
                "engine={nodeTimeout=" + engine.nodeTimeout +
                ", maxSteps=" + engine.maxSteps +
                "}, scheduler={type=" + scheduler.type +
                ", namePrefix='" + scheduler.namePrefix + '\'' +
                "}, dispatcher={maxAttempts=" + dispatcher.maxAttempts +
                ", baseDelay=" + dispatcher.baseDelay +
                ", maxDelay=" + dispatcher.maxDelay +
                ", jitterFactor=" + dispatcher.jitterFactor +
                ", cache=" + (dispatcher.cache.enabled ? dispatcher.cache.ttl : "disabled") +
                "}, checkpoint={ttl=" + checkpoint.ttl +
                "}}";
    }
}
