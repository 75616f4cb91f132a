package it.cavallium.cdclistener.core.common.cdc;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Undecoded event as received from the server.
 */
public record RawEvent(@NotNull String schemaId, byte @NotNull [] payload, @Nullable String eventId,
		@Nullable ReplayToken replayToken) {

	public RawEvent(@NotNull String schemaId, byte @NotNull [] payload) {
		this(schemaId, payload, null, null);
	}

	@Override
	public String toString() {
		return "RawEvent[schemaId=" + schemaId + ", eventId=" + eventId + ", replayToken=" + replayToken
				+ ", payload=" + payload.length + " bytes]";
	}
}
