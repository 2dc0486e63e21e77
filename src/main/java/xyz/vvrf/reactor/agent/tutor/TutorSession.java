package xyz.vvrf.reactor.agent.tutor;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 会话级的辅导资料：对话记录和当前难度。
 */
final class TutorSession {

    private final ConversationLog conversation = new ConversationLog();
    private final AtomicReference<DifficultyLevel> difficulty = new AtomicReference<>(DifficultyLevel.INTERMEDIATE);

    ConversationLog getConversation() {
        return conversation;
    }

    DifficultyLevel getDifficulty() {
        return difficulty.get();
    }

    DifficultyLevel adapt(double score) {
        return difficulty.updateAndGet(level -> level.adapt(score));
    }
}
