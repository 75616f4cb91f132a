package it.cavallium.cdclistener.core.config;

import it.cavallium.cdclistener.core.common.cdc.SubscriptionMode;
import java.time.Duration;
import org.github.gestalt.config.exceptions.GestaltException;

public interface SubscriptionConfig {

	String topic() throws GestaltException;

	SubscriptionMode mode() throws GestaltException;

	int batchSize() throws GestaltException;

	Duration idleTimeout() throws GestaltException;

	Duration retryDelay() throws GestaltException;

	boolean verifyTopic() throws GestaltException;
}
