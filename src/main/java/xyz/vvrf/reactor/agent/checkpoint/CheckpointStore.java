package xyz.vvrf.reactor.agent.checkpoint;

import java.util.Optional;

/**
 * 运行检查点存储。每个会话只保留最新代数的检查点。
 *
 * @param <S> 状态类型
 * @author ruifeng.wen
 */
public interface CheckpointStore<S> {

    /**
     * 保存检查点。旧代数的检查点不会覆盖新代数的检查点。
     *
     * @return 是否实际写入
     */
    boolean save(RunCheckpoint<S> checkpoint);

    Optional<RunCheckpoint<S>> load(String sessionId);

    /**
     * 丢弃指定代数的检查点 (被取消或被取代的运行)。其他代数的检查点不受影响。
     */
    void discard(String sessionId, long generation);

    /**
     * 删除会话的所有检查点。
     */
    void clear(String sessionId);
}
