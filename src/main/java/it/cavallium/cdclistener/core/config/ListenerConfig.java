package it.cavallium.cdclistener.core.config;

import org.github.gestalt.config.exceptions.GestaltException;

public interface ListenerConfig {

	String appName() throws GestaltException;

	AuthConfig auth() throws GestaltException;

	PubSubConfig pubsub() throws GestaltException;

	SubscriptionConfig subscription() throws GestaltException;

	HeartbeatConfig heartbeat() throws GestaltException;

	CheckpointConfig checkpoint() throws GestaltException;
}
