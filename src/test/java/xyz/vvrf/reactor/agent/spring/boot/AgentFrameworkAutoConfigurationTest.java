package xyz.vvrf.reactor.agent.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import xyz.vvrf.reactor.agent.dispatch.ProviderDispatcher;
import xyz.vvrf.reactor.agent.monitor.AgentMonitorListener;
import xyz.vvrf.reactor.agent.provider.ProviderClient;
import xyz.vvrf.reactor.agent.session.SessionConcurrencyController;
import xyz.vvrf.reactor.agent.transport.StreamTransportAdapter;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentFrameworkAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(AgentFrameworkAutoConfiguration.class));

    @Test
    @SuppressWarnings("unchecked")
    void defaults_createDispatcherWithProvidersInPriorityOrder() {
        runner.run(context -> {
            assertTrue(context.containsBean("agentNodeExecutionScheduler"));
            context.getBean(ProviderDispatcher.class);
            context.getBean(SessionConcurrencyController.class);
            context.getBean(StreamTransportAdapter.class);

            List<ProviderClient> clients = (List<ProviderClient>) context.getBean("agentProviderClients");
            assertEquals(3, clients.size());
            assertEquals("anthropic", clients.get(0).getName());
            assertEquals("openai", clients.get(1).getName());
            assertEquals("ollama", clients.get(2).getName());
            // 没有 API Key 的托管提供方不可用，本地提供方不需要凭证
            assertFalse(clients.get(0).isEnabled());
            assertTrue(clients.get(2).isEnabled());

            List<AgentMonitorListener> listeners = (List<AgentMonitorListener>) context.getBean("agentMonitorListeners");
            assertEquals(2, listeners.size());
        });
    }

    @Test
    @SuppressWarnings("unchecked")
    void properties_bindProviderAndDispatcherSettings() {
        runner.withPropertyValues(
                        "agent.providers.primary.api-key=sk-test",
                        "agent.providers.local.enabled=false",
                        "agent.dispatcher.max-attempts=5",
                        "agent.dispatcher.base-delay=250ms",
                        "agent.engine.max-steps=10")
                .run(context -> {
                    AgentFrameworkProperties properties = context.getBean(AgentFrameworkProperties.class);
                    assertEquals(5, properties.getDispatcher().getMaxAttempts());
                    assertEquals(Duration.ofMillis(250), properties.getDispatcher().getBaseDelay());
                    assertEquals(10, properties.getEngine().getMaxSteps());

                    List<ProviderClient> clients = (List<ProviderClient>) context.getBean("agentProviderClients");
                    assertTrue(clients.get(0).isEnabled());
                    assertFalse(clients.get(2).isEnabled());
                });
    }
}
