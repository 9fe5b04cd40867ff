package com.krabby.auth.platform;

import lombok.NonNull;
import lombok.val;

import java.time.Duration;

/**
 * A single deadline shared by every step of one request. Steps wait at most for the time that
 * remains, and {@link #check(String)} aborts the request once it has passed.
 */
public class RequestDeadline {

    private final Duration timeout;
    private final long expiresAtNanos;

    private RequestDeadline(@NonNull Duration timeout) {
        this.timeout = timeout;
        this.expiresAtNanos = System.nanoTime() + timeout.toNanos();
    }

    @NonNull
    public static RequestDeadline start(@NonNull Duration timeout) {
        return new RequestDeadline(timeout);
    }

    /**
     * @return the time left before the deadline, never negative.
     */
    @NonNull
    public Duration remaining() {
        return Duration.ofNanos(Math.max(0, expiresAtNanos - System.nanoTime()));
    }

    /**
     * @return the remaining time rounded up to whole seconds, at least one. Transaction timeouts
     * can't be any finer.
     */
    public int remainingSeconds() {
        val millis = remaining().toMillis();
        return (int) Math.max(1, (millis + 999) / 1000);
    }

    public boolean isExpired() {
        return expiresAtNanos - System.nanoTime() <= 0;
    }

    /**
     * @param step what the request was doing, used in the exception message.
     * @throws RequestTimeoutException if the deadline has passed.
     */
    public void check(@NonNull String step) {
        if (isExpired()) {
            throw new RequestTimeoutException(String.format("request exceeded its %s timeout after %s", timeout, step), null);
        }
    }
}
