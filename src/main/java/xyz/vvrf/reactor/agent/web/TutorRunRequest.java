package xyz.vvrf.reactor.agent.web;

import lombok.Data;

import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;

/**
 * 运行准入请求体。
 *
 * @author ruifeng.wen
 */
@Data
public class TutorRunRequest {

    @NotBlank
    private String sessionId;

    @NotBlank
    private String message;

    @Valid
    private List<HistoryMessage> history = new ArrayList<>();

    private List<String> contentIds = new ArrayList<>();

    /**
     * general / explain_concept / check_understanding (practice) / create_plan
     */
    private String action;

    @Data
    public static class HistoryMessage {
        @NotBlank
        private String role;
        @NotBlank
        private String content;
    }
}
