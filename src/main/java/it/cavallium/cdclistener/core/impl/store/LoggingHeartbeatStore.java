package it.cavallium.cdclistener.core.impl.store;

import it.cavallium.cdclistener.core.common.Heartbeat;
import it.cavallium.cdclistener.core.common.HeartbeatStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingHeartbeatStore implements HeartbeatStore {

	private final Logger logger = LoggerFactory.getLogger("listener.heartbeat");

	@Override
	public void put(@NotNull Heartbeat heartbeat) {
		logger.info("{} [{}/{}] at {}: {}", heartbeat.status(), heartbeat.group(), heartbeat.name(),
				heartbeat.timestamp(), heartbeat.message());
	}
}
