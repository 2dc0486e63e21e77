package xyz.vvrf.reactor.agent.checkpoint;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于 Caffeine 的内存检查点存储，写入后按 TTL 过期。
 *
 * @param <S> 状态类型
 * @author ruifeng.wen
 */
@Slf4j
public class CaffeineCheckpointStore<S> implements CheckpointStore<S> {

    private final Cache<String, RunCheckpoint<S>> cache;

    public CaffeineCheckpointStore(Duration ttl, long maximumSize) {
        Objects.requireNonNull(ttl, "检查点 TTL 不能为空");
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .build();
        log.info("CaffeineCheckpointStore 已创建。TTL: {}, 最大会话数: {}", ttl, maximumSize);
    }

    @Override
    public boolean save(RunCheckpoint<S> checkpoint) {
        Objects.requireNonNull(checkpoint, "检查点不能为空");
        AtomicBoolean written = new AtomicBoolean(false);
        cache.asMap().compute(checkpoint.getSessionId(), (sessionId, existing) -> {
            if (existing != null && existing.getGeneration() > checkpoint.getGeneration()) {
                return existing;
            }
            written.set(true);
            return checkpoint;
        });
        if (!written.get()) {
            log.debug("[Session: {}][Gen: {}] 检查点来自旧代数，已忽略。", checkpoint.getSessionId(), checkpoint.getGeneration());
        }
        return written.get();
    }

    @Override
    public Optional<RunCheckpoint<S>> load(String sessionId) {
        return Optional.ofNullable(cache.getIfPresent(sessionId));
    }

    @Override
    public void discard(String sessionId, long generation) {
        cache.asMap().computeIfPresent(sessionId, (id, existing) -> existing.getGeneration() == generation ? null : existing);
    }

    @Override
    public void clear(String sessionId) {
        cache.invalidate(sessionId);
    }
}
