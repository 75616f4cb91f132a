package it.cavallium.cdclistener.core.impl;

import it.cavallium.cdclistener.core.common.EventHandler;
import it.cavallium.cdclistener.core.common.cdc.DecodedEvent;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs every event and reports success.
 */
public class LoggingEventHandler implements EventHandler {

	private final Logger logger = LoggerFactory.getLogger("listener.events");

	@Override
	public boolean handle(@NotNull DecodedEvent event) {
		event.header().ifPresentOrElse(header -> {
			logger.info("{} {} {}: changed fields {}", header.changeType(), header.entityName(), header.recordIds(),
					header.changedFields());
			logger.debug("New values of changed fields: {}", event.changedValues());
		}, () -> logger.info("Event of schema {}: {}", event.schemaId(), event.fieldValues()));
		return true;
	}

	@Override
	public String toString() {
		return "LoggingEventHandler";
	}
}
