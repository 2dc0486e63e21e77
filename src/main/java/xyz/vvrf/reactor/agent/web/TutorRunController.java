package xyz.vvrf.reactor.agent.web;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import xyz.vvrf.reactor.agent.provider.ChatMessage;
import xyz.vvrf.reactor.agent.session.SessionSnapshot;
import xyz.vvrf.reactor.agent.transport.RunSubscription;
import xyz.vvrf.reactor.agent.transport.StreamFrame;
import xyz.vvrf.reactor.agent.transport.StreamFrames;
import xyz.vvrf.reactor.agent.tutor.DifficultyLevel;
import xyz.vvrf.reactor.agent.tutor.TutorAction;
import xyz.vvrf.reactor.agent.tutor.TutorRunService;
import xyz.vvrf.reactor.agent.tutor.TutorTurn;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 辅导运行的 HTTP 接口。运行事件以 NDJSON 输出，{@code Accept: text/event-stream} 时以 SSE 输出。
 * 客户端关闭连接等同于取消当前运行。
 *
 * @author ruifeng.wen
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/tutor")
public class TutorRunController {

    private final TutorRunService runService;

    public TutorRunController(TutorRunService runService) {
        this.runService = runService;
    }

    @PostMapping(value = "/runs", produces = MediaType.APPLICATION_NDJSON_VALUE)
    public Flux<StreamFrame> startRun(@Validated @RequestBody TutorRunRequest request) {
        return StreamFrames.toFrames(admit(request).events());
    }

    @PostMapping(value = "/runs", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<StreamFrame>> startRunAsEvents(@Validated @RequestBody TutorRunRequest request) {
        return StreamFrames.toServerSentEvents(admit(request).events());
    }

    private RunSubscription admit(TutorRunRequest request) {
        TutorTurn.TutorTurnBuilder turn = TutorTurn.builder()
                .sessionId(request.getSessionId())
                .message(request.getMessage())
                .action(TutorAction.fromWire(request.getAction()));
        if (request.getHistory() != null) {
            for (TutorRunRequest.HistoryMessage message : request.getHistory()) {
                turn.historyMessage(new ChatMessage(message.getRole(), message.getContent()));
            }
        }
        if (request.getContentIds() != null) {
            turn.contentIds(request.getContentIds());
        }
        RunSubscription subscription = runService.startRun(turn.build());
        log.debug("[Session: {}] 运行已准入 (Gen: {})", request.getSessionId(), subscription.getGeneration());
        return subscription;
    }

    @PostMapping("/sessions/{sessionId}/cancel")
    public Map<String, Object> cancel(@PathVariable String sessionId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessionId", sessionId);
        body.put("cancelled", runService.cancel(sessionId));
        return body;
    }

    @GetMapping(value = "/sessions/{sessionId}/events", produces = MediaType.APPLICATION_NDJSON_VALUE)
    public Flux<StreamFrame> subscribe(@PathVariable String sessionId) {
        return StreamFrames.toFrames(runService.subscribe(sessionId));
    }

    @GetMapping(value = "/sessions/{sessionId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<StreamFrame>> subscribeAsEvents(@PathVariable String sessionId) {
        return StreamFrames.toServerSentEvents(runService.subscribe(sessionId));
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<SessionSnapshot> snapshot(@PathVariable String sessionId) {
        return runService.snapshot(sessionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> closeSession(@PathVariable String sessionId) {
        return runService.closeSession(sessionId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @PostMapping("/sessions/{sessionId}/difficulty")
    public Map<String, Object> adaptDifficulty(@PathVariable String sessionId,
                                               @Validated @RequestBody DifficultyRequest request) {
        DifficultyLevel level = runService.adaptDifficulty(sessionId, request.getScore());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessionId", sessionId);
        body.put("difficulty", level.name().toLowerCase(Locale.ROOT));
        return body;
    }

    @GetMapping(value = "/graph/dot", produces = MediaType.TEXT_PLAIN_VALUE)
    public String graphDot() {
        return runService.graphDot();
    }
}
