package it.cavallium.cdclistener.core.common.cdc;

import java.time.Duration;
import org.jetbrains.annotations.NotNull;

/**
 * Options for streaming subscriptions.
 */
public record SubscribeOptions(
		int batchSize,
		@NotNull Duration idleTimeout,
		@NotNull Duration retryDelay
) {
	public static final int DEFAULT_BATCH_SIZE = 1;
	public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofMinutes(5);
	public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);

	public SubscribeOptions {
		if (batchSize <= 0) {
			throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
		}
		if (idleTimeout.isNegative() || idleTimeout.isZero()) {
			throw new IllegalArgumentException("idleTimeout must be positive: " + idleTimeout);
		}
	}

	public static SubscribeOptions defaults() {
		return new SubscribeOptions(DEFAULT_BATCH_SIZE, DEFAULT_IDLE_TIMEOUT, DEFAULT_RETRY_DELAY);
	}
}
