package it.cavallium.cdclistener.core.common;

import it.cavallium.cdclistener.core.common.cdc.ReplayToken;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;

/**
 * Durable storage of the last fully processed position of each topic.
 */
public interface ReplayCheckpointStore {

	Optional<ReplayToken> get(@NotNull String topic) throws ListenerException;

	void put(@NotNull String topic, @NotNull ReplayToken token) throws ListenerException;
}
