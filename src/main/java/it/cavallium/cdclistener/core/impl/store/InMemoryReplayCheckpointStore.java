package it.cavallium.cdclistener.core.impl.store;

import it.cavallium.cdclistener.core.common.ReplayCheckpointStore;
import it.cavallium.cdclistener.core.common.cdc.ReplayToken;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.jetbrains.annotations.NotNull;

/**
 * Checkpoints that live as long as the process. Useful for tests and for LATEST-only listeners.
 */
public class InMemoryReplayCheckpointStore implements ReplayCheckpointStore {

	private final ConcurrentHashMap<String, ReplayToken> tokens = new ConcurrentHashMap<>();

	@Override
	public Optional<ReplayToken> get(@NotNull String topic) {
		return Optional.ofNullable(tokens.get(topic));
	}

	@Override
	public void put(@NotNull String topic, @NotNull ReplayToken token) {
		tokens.put(topic, token);
	}
}
