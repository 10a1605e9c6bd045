package me.ud.ltc.tak.distributed.realtime.starter.client;

import lombok.Builder;
import lombok.Value;

/**
 * Tuning of a {@link BackendSelector}; all durations in milliseconds
 *
 * @author takltc
 */
@Value
@Builder
public class BackendSelectorOptions {

    /**
     * Consecutive push failures before falling back to polling in AUTO mode
     */
    @Builder.Default
    int maxPushFailures = 3;

    @Builder.Default
    long baseReconnectDelay = 1000;

    @Builder.Default
    long maxReconnectDelay = 30000;

    @Builder.Default
    long pollingInterval = 10000;

    /**
     * Consecutive polling failures before the status turns to ERROR
     */
    @Builder.Default
    int maxPollingFailures = 3;

    /**
     * Whether AUTO mode periodically retries push while polling
     */
    @Builder.Default
    boolean autoPromote = false;

    @Builder.Default
    long promoteInterval = 60000;

    public static BackendSelectorOptions defaults() {
        return BackendSelectorOptions.builder().build();
    }

    /**
     * Delay before the given reconnect attempt: the base delay doubled per attempt, capped
     *
     * @param attempt Attempt number, starting at 1
     * @return Delay
     */
    public long reconnectDelay(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        long delay = baseReconnectDelay << exponent;
        return delay < 0 ? maxReconnectDelay : Math.min(delay, maxReconnectDelay);
    }
}
