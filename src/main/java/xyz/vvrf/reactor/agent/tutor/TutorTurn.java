package xyz.vvrf.reactor.agent.tutor;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import xyz.vvrf.reactor.agent.provider.ChatMessage;

import java.util.List;

/**
 * 一次运行准入请求：会话、本轮消息、客户端携带的历史、材料引用和可选动作。
 *
 * @author ruifeng.wen
 */
@Value
@Builder
public class TutorTurn {
    String sessionId;
    String message;
    @Singular("historyMessage")
    List<ChatMessage> history;
    @Singular
    List<String> contentIds;
    TutorAction action;
}
