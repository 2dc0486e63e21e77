package xyz.vvrf.reactor.agent.transport;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import xyz.vvrf.reactor.agent.core.StreamEvent;

import java.util.Locale;

/**
 * 线上帧：{@code {"type":"fragment"|"error"|"done","content":...}}。
 * DONE 帧额外携带 {@code status}；所有帧都带有 generation 和 sequence。
 *
 * @author ruifeng.wen
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "content", "status", "generation", "sequence"})
public class StreamFrame {

    public static final String TYPE_FRAGMENT = "fragment";
    public static final String TYPE_ERROR = "error";
    public static final String TYPE_DONE = "done";

    private String type;
    private String content;
    private String status;
    private long generation;
    private long sequence;

    public static StreamFrame from(StreamEvent event) {
        String status = event.getStatus() != null ? event.getStatus().wireName() : null;
        return new StreamFrame(event.getKind().name().toLowerCase(Locale.ROOT), event.getPayload(), status,
                event.getGeneration(), event.getSequence());
    }
}
