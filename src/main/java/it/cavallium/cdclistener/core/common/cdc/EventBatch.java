package it.cavallium.cdclistener.core.common.cdc;

import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One server response. Events are kept in delivery order.
 * A batch without events is a keep-alive that still carries the latest replay token.
 */
public record EventBatch(@NotNull List<RawEvent> events, int pendingRequestedCount,
		@Nullable ReplayToken latestReplayToken) {

	public EventBatch {
		events = List.copyOf(events);
	}

	public boolean isKeepAlive() {
		return events.isEmpty();
	}

	public boolean isFullyDelivered() {
		return pendingRequestedCount == 0;
	}
}
