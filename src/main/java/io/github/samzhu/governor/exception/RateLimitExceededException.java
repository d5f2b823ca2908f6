package io.github.samzhu.governor.exception;

import java.time.Duration;
import java.util.Locale;

/**
 * 呼叫頻率超過滑動視窗上限。
 */
public class RateLimitExceededException extends AdmissionDeniedException {

    private final int maxCalls;
    private final Duration window;
    private final int callsInWindow;

    public RateLimitExceededException(int maxCalls, Duration window, int callsInWindow) {
        super(String.format(Locale.ROOT, "rate limit exceeded: %d calls in the last %ds (limit %d per %ds rolling window)",
                callsInWindow, window.toSeconds(), maxCalls, window.toSeconds()),
            "wait for older calls to leave the rolling window or raise governor.limiter.max-calls");
        this.maxCalls = maxCalls;
        this.window = window;
        this.callsInWindow = callsInWindow;
    }

    public int getMaxCalls() {
        return maxCalls;
    }

    public Duration getWindow() {
        return window;
    }

    public int getCallsInWindow() {
        return callsInWindow;
    }
}
