package xyz.vvrf.reactor.agent.transport;

import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import xyz.vvrf.reactor.agent.core.StreamEvent;

/**
 * 事件序列到线上帧的转换。NDJSON 由 WebFlux 的 Jackson 编码器按行输出。
 *
 * @author ruifeng.wen
 */
public final class StreamFrames {

    private StreamFrames() {
    }

    public static Flux<StreamFrame> toFrames(Flux<StreamEvent> events) {
        return events.map(StreamFrame::from);
    }

    /**
     * SSE 形式：事件名为帧类型，id 为 "代数-序号"。
     */
    public static Flux<ServerSentEvent<StreamFrame>> toServerSentEvents(Flux<StreamEvent> events) {
        return events.map(event -> {
            StreamFrame frame = StreamFrame.from(event);
            return ServerSentEvent.<StreamFrame>builder()
                    .id(event.getGeneration() + "-" + event.getSequence())
                    .event(frame.getType())
                    .data(frame)
                    .build();
        });
    }
}
