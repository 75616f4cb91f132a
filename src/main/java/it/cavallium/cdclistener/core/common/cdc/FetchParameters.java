package it.cavallium.cdclistener.core.common.cdc;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Parameters of the fetch requests sent on one subscribe attempt.
 */
public record FetchParameters(@NotNull String topic, @NotNull SubscriptionMode mode, @Nullable ReplayToken token) {

	public FetchParameters {
		if (mode == SubscriptionMode.CUSTOM && token == null) {
			throw new IllegalArgumentException("CUSTOM mode requires a replay token");
		}
	}
}
