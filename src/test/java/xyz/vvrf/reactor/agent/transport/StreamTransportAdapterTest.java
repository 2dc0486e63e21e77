package xyz.vvrf.reactor.agent.transport;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.agent.core.RunStatus;
import xyz.vvrf.reactor.agent.core.StreamEvent;
import xyz.vvrf.reactor.agent.execution.AgentRun;
import xyz.vvrf.reactor.agent.session.RunAdmission;
import xyz.vvrf.reactor.agent.session.SessionConcurrencyController;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreamTransportAdapterTest {

    private SessionConcurrencyController controller;
    private StreamTransportAdapter adapter;

    @BeforeEach
    void setUp() {
        controller = new SessionConcurrencyController();
        adapter = new StreamTransportAdapter(controller, Schedulers.immediate());
    }

    @Test
    void events_deliversRunEventsInOrderUntilDone() {
        ManualRun run = admit("s1");
        RunSubscription subscription = adapter.open(run.run, run.upstream.asFlux());
        run.fragment(0, "Hello");
        run.fragment(1, ", world");

        StepVerifier.create(subscription.events())
                .expectNextMatches(e -> e.getSequence() == 0 && "Hello".equals(e.getPayload()))
                .expectNextMatches(e -> e.getSequence() == 1)
                .then(() -> run.done(2, RunStatus.COMPLETED))
                .expectNextMatches(e -> e.getStatus() == RunStatus.COMPLETED)
                .verifyComplete();

        assertEquals(1L, subscription.getGeneration());
        assertFalse(run.run.isCancelled());
    }

    @Test
    void events_dropsDuplicateAndOutOfOrderSequences() {
        ManualRun run = admit("s1");
        RunSubscription subscription = adapter.open(run.run, run.upstream.asFlux());
        run.fragment(0, "a");
        run.fragment(0, "dup");
        run.fragment(2, "c");
        run.fragment(1, "late");
        run.done(3, RunStatus.COMPLETED);

        StepVerifier.create(subscription.events())
                .expectNextMatches(e -> "a".equals(e.getPayload()))
                .expectNextMatches(e -> "c".equals(e.getPayload()))
                .expectNextMatches(StreamEvent::isTerminal)
                .verifyComplete();
    }

    @Test
    void events_supersededRunEndsWithCancelledDoneAndNewRunStartsAtSequenceZero() {
        ManualRun first = admit("s1");
        RunSubscription firstSubscription = adapter.open(first.run, first.upstream.asFlux());
        first.fragment(0, "old");

        StepVerifier.create(firstSubscription.events())
                .expectNextMatches(e -> "old".equals(e.getPayload()))
                .then(() -> {
                    ManualRun second = admit("s1");
                    RunSubscription secondSubscription = adapter.open(second.run, second.upstream.asFlux());
                    second.fragment(0, "new");
                    second.done(1, RunStatus.COMPLETED);
                    // 旧运行继续输出，但已经不是当前代数
                    first.fragment(1, "stale");

                    StepVerifier.create(secondSubscription.events())
                            .expectNextMatches(e -> e.getGeneration() == 2 && e.getSequence() == 0)
                            .expectNextMatches(e -> e.getGeneration() == 2 && e.isTerminal())
                            .verifyComplete();
                })
                // 调用方收到本代数的 done(cancelled)，序号沿用未投递的过期事件
                .expectNextMatches(e -> e.getGeneration() == 1 && e.getSequence() == 1
                        && e.isTerminal() && e.getStatus() == RunStatus.CANCELLED)
                .verifyComplete();

        assertTrue(first.run.isCancelled());
    }

    @Test
    void subscribe_replaysLatestRunAndFollowsNewerRuns() {
        ManualRun first = admit("s1");
        adapter.open(first.run, first.upstream.asFlux());
        first.fragment(0, "one");
        first.fragment(1, "two");

        StepVerifier.create(adapter.subscribe("s1"))
                .expectNextMatches(e -> e.getGeneration() == 1 && e.getSequence() == 0)
                .expectNextMatches(e -> e.getGeneration() == 1 && e.getSequence() == 1)
                .then(() -> {
                    ManualRun second = admit("s1");
                    adapter.open(second.run, second.upstream.asFlux());
                    first.done(2, RunStatus.CANCELLED);
                    second.fragment(0, "fresh");
                    second.done(1, RunStatus.COMPLETED);
                })
                .expectNextMatches(e -> e.getGeneration() == 2 && "fresh".equals(e.getPayload()))
                .expectNextMatches(e -> e.getGeneration() == 2 && e.getStatus() == RunStatus.COMPLETED)
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void subscribe_neverSeesCancelledDoneOfSupersededRun() {
        ManualRun first = admit("s1");
        RunSubscription firstSubscription = adapter.open(first.run, first.upstream.asFlux());
        first.fragment(0, "old");

        StepVerifier.create(adapter.subscribe("s1"))
                .expectNextMatches(e -> e.getGeneration() == 1 && "old".equals(e.getPayload()))
                .then(() -> {
                    ManualRun second = admit("s1");
                    adapter.open(second.run, second.upstream.asFlux());
                    first.fragment(1, "stale");
                    StepVerifier.create(firstSubscription.events())
                            .expectNextMatches(e -> "old".equals(e.getPayload()))
                            .expectNextMatches(e -> e.getGeneration() == 1 && e.getStatus() == RunStatus.CANCELLED)
                            .verifyComplete();
                    second.done(0, RunStatus.COMPLETED);
                })
                .expectNextMatches(e -> e.getGeneration() == 2 && e.getStatus() == RunStatus.COMPLETED)
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void subscribe_expiredSessionNoLongerReplaysOldRun() {
        AtomicLong nanos = new AtomicLong();
        // 控制器使用系统时钟，会话代数不会过期，只有事件通道过期
        StreamTransportAdapter expiringAdapter = new StreamTransportAdapter(controller, Schedulers.immediate(),
                Duration.ofMinutes(10), 100, nanos::get);
        RunAdmission admission = controller.startRun("s1");
        ManualRun run = new ManualRun(new AgentRun("s1", admission.getGeneration(), null, admission.getToken()));
        expiringAdapter.open(run.run, run.upstream.asFlux());
        run.done(0, RunStatus.COMPLETED);

        nanos.addAndGet(TimeUnit.MINUTES.toNanos(11));

        StepVerifier.create(expiringAdapter.subscribe("s1"))
                .expectSubscription()
                .expectNoEvent(Duration.ofMillis(100))
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void subscribe_disconnectDoesNotCancelRun() {
        ManualRun run = admit("s1");
        adapter.open(run.run, run.upstream.asFlux());
        run.fragment(0, "x");

        StepVerifier.create(adapter.subscribe("s1"))
                .expectNextCount(1)
                .thenCancel()
                .verify();

        assertFalse(run.run.isCancelled());
    }

    @Test
    void events_clientDisconnectCancelsRun() {
        ManualRun run = admit("s1");
        RunSubscription subscription = adapter.open(run.run, run.upstream.asFlux());
        run.fragment(0, "x");

        StepVerifier.create(subscription.events())
                .expectNextCount(1)
                .thenCancel()
                .verify();

        assertTrue(run.run.isCancelled());
    }

    @Test
    void events_propagatesUpstreamFailure() {
        ManualRun run = admit("s1");
        RunSubscription subscription = adapter.open(run.run, run.upstream.asFlux());
        run.upstream.tryEmitError(new IllegalStateException("engine crashed"));

        StepVerifier.create(subscription.events())
                .expectErrorMessage("engine crashed")
                .verify();
    }

    @Test
    void cancel_cancelsUnderlyingRun() {
        ManualRun run = admit("s1");
        RunSubscription subscription = adapter.open(run.run, run.upstream.asFlux());

        assertTrue(subscription.cancel());
        assertFalse(subscription.cancel());
        assertTrue(run.run.isCancelled());
    }

    private ManualRun admit(String sessionId) {
        RunAdmission admission = controller.startRun(sessionId);
        admission.cancelPrevious();
        AgentRun run = new AgentRun(sessionId, admission.getGeneration(), null, admission.getToken());
        controller.attach(run);
        return new ManualRun(run);
    }

    /**
     * 手动推送事件的运行。
     */
    private static final class ManualRun {
        private final AgentRun run;
        private final Sinks.Many<StreamEvent> upstream = Sinks.many().unicast().onBackpressureBuffer();

        private ManualRun(AgentRun run) {
            this.run = run;
        }

        void fragment(long sequence, String text) {
            upstream.tryEmitNext(StreamEvent.fragment(run.getGeneration(), sequence, text));
        }

        void done(long sequence, RunStatus status) {
            upstream.tryEmitNext(StreamEvent.done(run.getGeneration(), sequence, status));
            upstream.tryEmitComplete();
        }
    }
}
