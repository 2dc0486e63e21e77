package xyz.vvrf.reactor.agent.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.web.reactive.function.client.WebClientAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.agent.dispatch.BackoffPolicy;
import xyz.vvrf.reactor.agent.dispatch.CompletionCache;
import xyz.vvrf.reactor.agent.dispatch.DispatcherSettings;
import xyz.vvrf.reactor.agent.dispatch.ProviderDispatcher;
import xyz.vvrf.reactor.agent.dispatch.RetryingProviderDispatcher;
import xyz.vvrf.reactor.agent.monitor.AgentMonitorListener;
import xyz.vvrf.reactor.agent.monitor.LoggingAgentMonitorListener;
import xyz.vvrf.reactor.agent.monitor.MicrometerAgentMonitorListener;
import xyz.vvrf.reactor.agent.provider.ProviderClient;
import xyz.vvrf.reactor.agent.provider.ProviderSettings;
import xyz.vvrf.reactor.agent.provider.ProviderVariant;
import xyz.vvrf.reactor.agent.provider.http.AnthropicProviderClient;
import xyz.vvrf.reactor.agent.provider.http.OllamaProviderClient;
import xyz.vvrf.reactor.agent.provider.http.OpenAiProviderClient;
import xyz.vvrf.reactor.agent.session.SessionConcurrencyController;
import xyz.vvrf.reactor.agent.transport.StreamTransportAdapter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Agent 框架的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link AgentFrameworkProperties}。
 * 2. 提供节点执行调度器 ("agentNodeExecutionScheduler")，类型由属性配置。
 * 3. 按 primary / fallback / local 创建提供方客户端，并组装共享的 {@link ProviderDispatcher}。
 * 4. 提供会话并发控制器和流传输适配器。
 * 5. 收集所有的 {@link AgentMonitorListener} Bean 到一个列表 Bean ("agentMonitorListeners")。
 * <p>
 * 所有 Bean 都可以通过定义同类型 (或同名) 的 Bean 覆盖。
 * 具体的图、节点注册表和引擎由应用自己定义，参见 {@code TutorGraphConfiguration}。
 *
 * @author ruifeng.wen
 */
@Configuration
@AutoConfigureAfter({JacksonAutoConfiguration.class, WebClientAutoConfiguration.class})
@EnableConfigurationProperties(AgentFrameworkProperties.class)
@Slf4j
public class AgentFrameworkAutoConfiguration {

    private final ApplicationContext applicationContext;

    public AgentFrameworkAutoConfiguration(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
        log.info("Agent 框架自动配置 (AgentFrameworkAutoConfiguration) 已加载。");
    }

    /**
     * 节点执行调度器。每个运行的节点都在此调度器上执行。
     */
    @Bean(name = "agentNodeExecutionScheduler")
    @ConditionalOnMissingBean(name = "agentNodeExecutionScheduler")
    public Scheduler agentNodeExecutionScheduler(AgentFrameworkProperties properties) {
        AgentFrameworkProperties.SchedulerProps schedulerProps = properties.getScheduler();
        String namePrefix = schedulerProps.getNamePrefix();
        AgentFrameworkProperties.BoundedElasticProps beProps = schedulerProps.getBoundedElastic();

        switch (schedulerProps.getType()) {
            case BOUNDED_ELASTIC:
                log.info("正在创建 'agentNodeExecutionScheduler' (BoundedElastic): prefix={}, cap={}, queue={}, ttl={}s",
                        namePrefix, beProps.getThreadCap(), beProps.getQueuedTaskCap(), beProps.getTtlSeconds());
                return Schedulers.newBoundedElastic(beProps.getThreadCap(), beProps.getQueuedTaskCap(), namePrefix, beProps.getTtlSeconds(), true);
            case PARALLEL:
                int parallelism = schedulerProps.getParallel().getParallelism();
                log.info("正在创建 'agentNodeExecutionScheduler' (Parallel): prefix={}, parallelism={}", namePrefix, parallelism);
                return Schedulers.newParallel(namePrefix, parallelism, true);
            case SINGLE:
                log.info("正在创建 'agentNodeExecutionScheduler' (Single): prefix={}", namePrefix);
                return Schedulers.newSingle(namePrefix, true);
            case CUSTOM:
                String customBeanName = schedulerProps.getCustomBeanName();
                if (customBeanName == null || customBeanName.trim().isEmpty()) {
                    log.error("'agent.scheduler.type=CUSTOM' 但 'agent.scheduler.custom-bean-name' 未配置。回退到默认 BoundedElastic。");
                    return Schedulers.newBoundedElastic(beProps.getThreadCap(), beProps.getQueuedTaskCap(),
                            namePrefix + "-fallback", beProps.getTtlSeconds(), true);
                }
                log.info("正在从 Spring 上下文获取自定义 'agentNodeExecutionScheduler' Bean，名称: {}", customBeanName);
                try {
                    return applicationContext.getBean(customBeanName, Scheduler.class);
                } catch (Exception e) {
                    log.error("获取自定义 Scheduler Bean '{}' 失败。回退到默认 BoundedElastic。", customBeanName, e);
                    return Schedulers.newBoundedElastic(beProps.getThreadCap(), beProps.getQueuedTaskCap(),
                            namePrefix + "-fallback-custom-failed", beProps.getTtlSeconds(), true);
                }
            default:
                log.warn("未知的 'agent.scheduler.type': {}. 回退到默认 BoundedElastic。", schedulerProps.getType());
                return Schedulers.newBoundedElastic(beProps.getThreadCap(), beProps.getQueuedTaskCap(),
                        namePrefix + "-default", beProps.getTtlSeconds(), true);
        }
    }

    @Bean
    @ConditionalOnMissingBean(ObjectMapper.class)
    public ObjectMapper agentObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean(WebClient.Builder.class)
    public WebClient.Builder agentWebClientBuilder() {
        return WebClient.builder();
    }

    /**
     * 按 primary -> fallback -> local 的顺序创建提供方客户端。
     * 未启用或缺少凭证的提供方仍会被创建，但调度器会跳过它们。
     */
    @Bean(name = "agentProviderClients")
    @ConditionalOnMissingBean(name = "agentProviderClients")
    public List<ProviderClient> agentProviderClients(AgentFrameworkProperties properties,
                                                     WebClient.Builder webClientBuilder,
                                                     ObjectMapper objectMapper) {
        AgentFrameworkProperties.Providers providers = properties.getProviders();
        List<ProviderClient> clients = new ArrayList<>();
        clients.add(new AnthropicProviderClient(toSettings(providers.getPrimary(), ProviderVariant.PRIMARY), webClientBuilder, objectMapper));
        clients.add(new OpenAiProviderClient(toSettings(providers.getFallback(), ProviderVariant.FALLBACK), webClientBuilder, objectMapper));
        clients.add(new OllamaProviderClient(toSettings(providers.getLocal(), ProviderVariant.LOCAL), webClientBuilder, objectMapper));
        log.info("已创建 {} 个提供方客户端: {}", clients.size(),
                clients.stream().map(c -> c.getName() + (c.isEnabled() ? "" : "(禁用)")).collect(Collectors.joining(", ")));
        return Collections.unmodifiableList(clients);
    }

    private static ProviderSettings toSettings(AgentFrameworkProperties.Provider provider, ProviderVariant variant) {
        return ProviderSettings.builder()
                .name(provider.getName() != null ? provider.getName() : variant.name().toLowerCase(Locale.ROOT))
                .variant(variant)
                .enabled(provider.isEnabled())
                .baseUrl(provider.getBaseUrl())
                .apiKey(provider.getApiKey())
                .model(provider.getModel())
                .timeout(provider.getTimeout())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean(CompletionCache.class)
    public CompletionCache completionCache(AgentFrameworkProperties properties) {
        AgentFrameworkProperties.Cache cache = properties.getDispatcher().getCache();
        log.info("正在创建 CompletionCache: ttl={}, maxSize={}, enabled={}", cache.getTtl(), cache.getMaxSize(), cache.isEnabled());
        return new CompletionCache(cache.getTtl(), cache.getMaxSize());
    }

    @Bean
    @ConditionalOnMissingBean(ProviderDispatcher.class)
    public ProviderDispatcher providerDispatcher(AgentFrameworkProperties properties,
                                                 @Qualifier("agentProviderClients") List<ProviderClient> providerClients,
                                                 CompletionCache completionCache,
                                                 @Qualifier("agentMonitorListeners") List<AgentMonitorListener> monitorListeners) {
        AgentFrameworkProperties.Dispatcher props = properties.getDispatcher();
        DispatcherSettings settings = DispatcherSettings.builder()
                .maxAttempts(props.getMaxAttempts())
                .baseDelay(props.getBaseDelay())
                .maxDelay(props.getMaxDelay())
                .jitterFactor(props.getJitterFactor())
                .build();
        return new RetryingProviderDispatcher(providerClients, settings, BackoffPolicy.from(settings), Schedulers.parallel(),
                props.getCache().isEnabled() ? completionCache : null, monitorListeners);
    }

    @Bean
    @ConditionalOnMissingBean(SessionConcurrencyController.class)
    public SessionConcurrencyController sessionConcurrencyController(AgentFrameworkProperties properties) {
        AgentFrameworkProperties.Session session = properties.getSession();
        return new SessionConcurrencyController(session.getTtl(), session.getMaxSessions());
    }

    @Bean
    @ConditionalOnMissingBean(StreamTransportAdapter.class)
    public StreamTransportAdapter streamTransportAdapter(AgentFrameworkProperties properties,
                                                         SessionConcurrencyController controller,
                                                         @Qualifier("agentNodeExecutionScheduler") Scheduler scheduler) {
        AgentFrameworkProperties.Session session = properties.getSession();
        return new StreamTransportAdapter(controller, scheduler, session.getTtl(), session.getMaxSessions());
    }

    @Bean
    @ConditionalOnMissingBean(LoggingAgentMonitorListener.class)
    public LoggingAgentMonitorListener loggingAgentMonitorListener() {
        return new LoggingAgentMonitorListener();
    }

    /**
     * 没有 Actuator 提供 MeterRegistry 时使用内存注册表，保证指标监听器总能工作。
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry agentMeterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(MicrometerAgentMonitorListener.class)
    public MicrometerAgentMonitorListener micrometerAgentMonitorListener(MeterRegistry meterRegistry) {
        return new MicrometerAgentMonitorListener(meterRegistry);
    }

    /**
     * 收集在应用上下文中定义的所有 AgentMonitorListener Bean，作为名为 "agentMonitorListeners" 的不可变列表提供。
     */
    @Bean(name = "agentMonitorListeners")
    @ConditionalOnMissingBean(name = "agentMonitorListeners")
    public List<AgentMonitorListener> agentMonitorListeners(ObjectProvider<AgentMonitorListener> listenersProvider) {
        log.info("正在收集 AgentMonitorListener Bean...");
        List<AgentMonitorListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 AgentMonitorListener Bean。");
        } else {
            log.info("收集到 {} 个 AgentMonitorListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        return Collections.unmodifiableList(listeners);
    }
}
