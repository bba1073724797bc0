package org.deduction.utils;

import java.time.Duration;
import java.util.Objects;

/**
 * 协作式取消令牌。搜索循环在每个检查点查询 {@link #isCancelled()}，
 * 令牌在被手动取消或超过截止时间后返回 true。
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false, 0L);

    private final boolean hasDeadline;
    private final long deadlineNanos;
    private volatile boolean cancelled;

    private CancellationToken(boolean hasDeadline, long deadlineNanos) {
        this.hasDeadline = hasDeadline;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * 永不超时、也不能被取消的令牌。
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * 只能手动取消的令牌。
     */
    public static CancellationToken manual() {
        return new CancellationToken(false, 0L);
    }

    public static CancellationToken withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "Timeout cannot be null.");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        return new CancellationToken(true, System.nanoTime() + timeout.toNanos());
    }

    /**
     * 按毫秒数构造；非正数表示没有时限。
     */
    public static CancellationToken withTimeoutMillis(long millis) {
        return millis <= 0 ? manual() : withTimeout(Duration.ofMillis(millis));
    }

    public void cancel() {
        if (this == NONE) {
            throw new IllegalStateException("The shared no-op token cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || (hasDeadline && System.nanoTime() - deadlineNanos >= 0);
    }

    @Override
    public String toString() {
        return "CancellationToken{cancelled=" + isCancelled() + (hasDeadline ? ", deadline" : "") + '}';
    }
}
