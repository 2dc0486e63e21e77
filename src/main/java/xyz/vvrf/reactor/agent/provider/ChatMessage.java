package xyz.vvrf.reactor.agent.provider;

import lombok.Value;

/**
 * 对话中的一条消息。
 *
 * @author ruifeng.wen
 */
@Value
public class ChatMessage {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM = "system";

    String role;
    String content;

    public static ChatMessage user(String content) {
        return new ChatMessage(ROLE_USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ROLE_ASSISTANT, content);
    }
}
