package it.cavallium.cdclistener.core.config;

import it.cavallium.cdclistener.core.common.ListenerException;
import it.cavallium.cdclistener.core.common.ListenerException.ListenerErrorType;
import org.github.gestalt.config.exceptions.GestaltException;

/**
 * Renders the effective configuration. Secrets are masked.
 */
public class ConfigPrinter {

	private static final String MASK = "******";

	public static String stringify(ListenerConfig config) {
		try {
			return stringifyListener(config);
		} catch (GestaltException e) {
			throw ListenerException.of(ListenerErrorType.CONFIG_ERROR, "Can't stringify config", e);
		}
	}

	public static String stringifyListener(ListenerConfig o) throws GestaltException {
		return """
				{
				  "app-name": "%s",
				  "auth": %s,
				  "pubsub": %s,
				  "subscription": %s,
				  "heartbeat": %s,
				  "checkpoint": %s
				}""".formatted(o.appName(),
				stringifyAuth(o.auth()),
				stringifyPubSub(o.pubsub()),
				stringifySubscription(o.subscription()),
				stringifyHeartbeat(o.heartbeat()),
				stringifyCheckpoint(o.checkpoint()));
	}

	public static String stringifyAuth(AuthConfig o) throws GestaltException {
		return """
				{
				    "login-url": "%s",
				    "username": "%s",
				    "password": "%s",
				    "client-id": "%s",
				    "client-secret": "%s",
				    "tenant-id": "%s"
				  }\
				""".formatted(o.loginUrl(),
				o.username(),
				mask(o.password()),
				o.clientId(),
				mask(o.clientSecret()),
				o.tenantId());
	}

	public static String stringifyPubSub(PubSubConfig o) throws GestaltException {
		return """
				{
				    "host": "%s",
				    "port": %d,
				    "plaintext": %b,
				    "request-timeout": "%s"
				  }\
				""".formatted(o.host(), o.port(), o.plaintext(), o.requestTimeout());
	}

	public static String stringifySubscription(SubscriptionConfig o) throws GestaltException {
		return """
				{
				    "topic": "%s",
				    "mode": "%s",
				    "batch-size": %d,
				    "idle-timeout": "%s",
				    "retry-delay": "%s",
				    "verify-topic": %b
				  }\
				""".formatted(o.topic(), o.mode(), o.batchSize(), o.idleTimeout(), o.retryDelay(), o.verifyTopic());
	}

	public static String stringifyHeartbeat(HeartbeatConfig o) throws GestaltException {
		return """
				{
				    "enabled": %b,
				    "group": "%s",
				    "name": "%s"
				  }\
				""".formatted(o.enabled(), o.group(), o.name());
	}

	public static String stringifyCheckpoint(CheckpointConfig o) throws GestaltException {
		return """
				{
				    "type": "%s",
				    "directory": "%s"
				  }\
				""".formatted(o.type(), o.directory());
	}

	private static String mask(String secret) {
		return secret == null || secret.isEmpty() ? "" : MASK;
	}
}
