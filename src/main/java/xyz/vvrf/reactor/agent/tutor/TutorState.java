package xyz.vvrf.reactor.agent.tutor;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import xyz.vvrf.reactor.agent.provider.ChatMessage;

import java.util.List;

/**
 * 在辅导图的节点之间传递的不可变状态。节点通过 {@code with*} 方法产出新状态。
 * <p>
 * 对话记录是共享的只追加日志，状态只保存本轮用户消息的下标 {@code turnIndex}；
 * 节点按下标读取切片，不复制整个历史。
 *
 * @author ruifeng.wen
 */
@Value
@With
@Builder(toBuilder = true)
public class TutorState {

    /**
     * 构建提示词时最多携带的历史消息条数。
     */
    public static final int HISTORY_WINDOW = 12;

    String sessionId;
    ConversationLog conversation;
    int turnIndex;
    String userMessage;
    @Singular
    List<String> contentIds;
    TutorAction requestedAction;
    @Builder.Default
    DifficultyLevel difficulty = DifficultyLevel.INTERMEDIATE;

    Intent intent;
    boolean practiceRequested;
    @Singular
    List<ContentPassage> passages;
    String explanation;
    String practiceQuestions;
    String studyPlan;
    String response;
    @Singular
    List<String> actionItems;

    public boolean hasContent() {
        return !contentIds.isEmpty();
    }

    public boolean hasExplicitAction() {
        return requestedAction != null && requestedAction != TutorAction.GENERAL;
    }

    /**
     * 本轮之前的最近若干条历史消息 (不含本轮用户消息)。
     */
    public List<ChatMessage> recentHistory() {
        return conversation.window(turnIndex, HISTORY_WINDOW);
    }
}
