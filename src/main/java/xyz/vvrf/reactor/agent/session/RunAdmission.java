package xyz.vvrf.reactor.agent.session;

import lombok.Getter;
import xyz.vvrf.reactor.agent.core.CancellationToken;

/**
 * 一次运行准入的结果：新分配的代数、新运行的取消令牌，以及取消上一个运行的触发器。
 *
 * @author ruifeng.wen
 */
@Getter
public final class RunAdmission {

    private final String sessionId;
    private final long generation;
    private final CancellationToken token;
    /**
     * 被取代的运行的代数，没有时为 0。
     */
    private final long supersededGeneration;
    private final CancellationToken previousToken;

    RunAdmission(String sessionId, long generation, CancellationToken token, long supersededGeneration, CancellationToken previousToken) {
        this.sessionId = sessionId;
        this.generation = generation;
        this.token = token;
        this.supersededGeneration = supersededGeneration;
        this.previousToken = previousToken;
    }

    /**
     * 取消被取代的运行。没有上一个运行时什么也不做。
     *
     * @return 是否真的触发了取消
     */
    public boolean cancelPrevious() {
        return previousToken != null && previousToken.cancel();
    }
}
