package it.cavallium.cdclistener.core.common;

import java.time.Instant;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Liveness record written by a listener before every subscribe attempt.
 */
public record Heartbeat(@NotNull String group, @NotNull String name, @NotNull Instant timestamp,
		@NotNull String status, @Nullable String message) {

	public static final String STATUS_HEARTBEAT = "HEARTBEAT";

	public static Heartbeat now(String group, String name, String message) {
		return new Heartbeat(group, name, Instant.now(), STATUS_HEARTBEAT, message);
	}
}
