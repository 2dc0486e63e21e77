package xyz.vvrf.reactor.agent.tutor;

import xyz.vvrf.reactor.agent.provider.ChatMessage;
import xyz.vvrf.reactor.agent.provider.CompletionRequest;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * 辅导图使用的提示词和请求构造。
 *
 * @author ruifeng.wen
 */
public final class TutorPrompts {

    static final String TUTOR_SYSTEM = "You are an expert AI tutor. Understand the student's goals and current level, "
            + "explain concepts clearly with examples, break complex topics into manageable pieces, "
            + "and always finish with actionable next steps.";

    static final String INTENT_SYSTEM = "Classify the student's request. Answer with exactly one label: "
            + "EXPLAIN, EXPLAIN_AND_PRACTICE, PRACTICE, STUDY_PLAN or GENERAL.";

    private static final Duration INTENT_TIMEOUT = Duration.ofSeconds(15);
    private static final int MAX_PASSAGE_CHARS = 4000;

    private TutorPrompts() {
    }

    /**
     * 意图分类请求：温度为 0，可缓存。
     */
    public static CompletionRequest intent(TutorState state) {
        return CompletionRequest.builder()
                .system(INTENT_SYSTEM)
                .message(ChatMessage.user(state.getUserMessage()))
                .temperature(0.0)
                .maxTokens(16)
                .timeout(INTENT_TIMEOUT)
                .cacheable(true)
                .build();
    }

    public static CompletionRequest explanation(TutorState state) {
        String prompt = "Explain the following so the student really understands it.\n"
                + "Start with a simple overview, use an analogy or example, break down the hard parts, "
                + "highlight the key points and suggest ways to practice.\n\n"
                + "Student request: " + state.getUserMessage()
                + materials(state.getPassages());
        return conversational(state, prompt, 0.7, 1500);
    }

    public static CompletionRequest practice(TutorState state) {
        String prompt = "Create 3-5 questions that check understanding of the topic below.\n"
                + "Difficulty level: " + state.getDifficulty().name().toLowerCase(Locale.ROOT) + "\n"
                + "Mix recall and application questions, and number them.\n\n"
                + "Topic: " + state.getUserMessage()
                + (state.getExplanation() != null ? "\n\nExplanation already given:\n" + state.getExplanation() : "")
                + materials(state.getPassages());
        return conversational(state, prompt, 0.7, 1000);
    }

    public static CompletionRequest studyPlan(TutorState state) {
        String prompt = "Create a personalized study plan for the goal below.\n"
                + "Current level: " + state.getDifficulty().name().toLowerCase(Locale.ROOT) + "\n"
                + "Break it into learning objectives with a suggested order, milestones and review points.\n\n"
                + "Goal: " + state.getUserMessage();
        return conversational(state, prompt, 0.7, 1500);
    }

    public static CompletionRequest general(TutorState state) {
        return conversational(state, state.getUserMessage(), 0.7, 1024);
    }

    private static CompletionRequest conversational(TutorState state, String prompt, double temperature, int maxTokens) {
        List<ChatMessage> history = state.recentHistory();
        return CompletionRequest.builder()
                .system(TUTOR_SYSTEM)
                .messages(history)
                .message(ChatMessage.user(prompt))
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();
    }

    private static String materials(List<ContentPassage> passages) {
        if (passages == null || passages.isEmpty()) {
            return "";
        }
        StringBuilder text = new StringBuilder("\n\nStudy materials:");
        for (ContentPassage passage : passages) {
            String body = passage.getText();
            if (body != null && body.length() > MAX_PASSAGE_CHARS) {
                body = body.substring(0, MAX_PASSAGE_CHARS);
            }
            text.append("\n--- ").append(passage.getTitle()).append(" ---\n").append(body);
        }
        return text.toString();
    }
}
