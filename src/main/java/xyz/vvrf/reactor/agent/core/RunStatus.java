package xyz.vvrf.reactor.agent.core;

import java.util.Locale;

/**
 * 运行的生命周期状态。
 * PENDING -> RUNNING -> {COMPLETED, ERRORED, CANCELLED}，终态不可再变。
 *
 * @author ruifeng.wen
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    ERRORED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERRORED || this == CANCELLED;
    }

    /**
     * 线路格式中使用的小写名称，例如 "cancelled"。
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
