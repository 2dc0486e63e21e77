package xyz.vvrf.reactor.agent.execution;

import reactor.core.publisher.FluxSink;
import xyz.vvrf.reactor.agent.core.RunStatus;
import xyz.vvrf.reactor.agent.core.StreamEvent;

/**
 * 一次运行的事件出口。负责分配序号，并保证 DONE 之后不再发出任何事件。
 * 运行被取消后到达的片段直接丢弃。
 */
final class RunEventSink {

    private final AgentRun run;
    private final FluxSink<StreamEvent> sink;
    private boolean closed;

    RunEventSink(AgentRun run, FluxSink<StreamEvent> sink) {
        this.run = run;
        this.sink = sink;
    }

    synchronized boolean fragment(String text) {
        if (closed || run.isCancelled()) {
            return false;
        }
        sink.next(StreamEvent.fragment(run.getGeneration(), run.nextSequence(), text));
        return true;
    }

    synchronized void error(String message) {
        if (closed) {
            return;
        }
        sink.next(StreamEvent.error(run.getGeneration(), run.nextSequence(), message));
    }

    synchronized void done(RunStatus status) {
        if (closed) {
            return;
        }
        closed = true;
        sink.next(StreamEvent.done(run.getGeneration(), run.nextSequence(), status));
        sink.complete();
    }
}
