package it.cavallium.cdclistener.core.impl.store;

import it.cavallium.cdclistener.core.common.Heartbeat;
import it.cavallium.cdclistener.core.common.HeartbeatStore;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.jetbrains.annotations.NotNull;

/**
 * Keeps only the latest heartbeat of each group and name, for applications embedding a listener that want to poll
 * its liveness.
 */
public class InMemoryHeartbeatStore implements HeartbeatStore {

	private final Map<HeartbeatKey, Heartbeat> latest = new ConcurrentHashMap<>();

	@Override
	public void put(@NotNull Heartbeat heartbeat) {
		latest.put(new HeartbeatKey(heartbeat.group(), heartbeat.name()), heartbeat);
	}

	public List<Heartbeat> heartbeats() {
		return List.copyOf(latest.values());
	}

	public Optional<Heartbeat> latest(@NotNull String group, @NotNull String name) {
		return Optional.ofNullable(latest.get(new HeartbeatKey(group, name)));
	}

	private record HeartbeatKey(String group, String name) {}
}
