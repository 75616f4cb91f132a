package it.cavallium.cdclistener.core.listener;

import static java.util.Objects.requireNonNull;

import it.cavallium.cdclistener.core.client.SubscriptionClient;
import it.cavallium.cdclistener.core.common.EventHandler;
import it.cavallium.cdclistener.core.common.HeartbeatStore;
import it.cavallium.cdclistener.core.common.ReplayCheckpointStore;
import it.cavallium.cdclistener.core.common.cdc.SubscribeOptions;
import it.cavallium.cdclistener.core.impl.AvroEventDecoder;
import it.cavallium.cdclistener.core.impl.EventDecoder;

public class ListenerBuilder {

	public static final String DEFAULT_HEARTBEAT_GROUP = "CDC";

	private SubscriptionClient client;
	private EventDecoder decoder;
	private EventHandler eventHandler;
	private ReplayCheckpointStore checkpointStore;
	private HeartbeatStore heartbeatStore;
	private String topic;
	private SubscribeOptions options = SubscribeOptions.defaults();
	private String heartbeatGroup = DEFAULT_HEARTBEAT_GROUP;
	private String heartbeatName;
	private boolean verifyTopic = true;

	public ListenerBuilder setClient(SubscriptionClient client) {
		this.client = client;
		return this;
	}

	public ListenerBuilder setDecoder(EventDecoder decoder) {
		this.decoder = decoder;
		return this;
	}

	public ListenerBuilder setEventHandler(EventHandler eventHandler) {
		this.eventHandler = eventHandler;
		return this;
	}

	public ListenerBuilder setCheckpointStore(ReplayCheckpointStore checkpointStore) {
		this.checkpointStore = checkpointStore;
		return this;
	}

	/**
	 * Optional, heartbeats are not written if not set.
	 */
	public ListenerBuilder setHeartbeatStore(HeartbeatStore heartbeatStore) {
		this.heartbeatStore = heartbeatStore;
		return this;
	}

	public ListenerBuilder setTopic(String topic) {
		this.topic = topic;
		return this;
	}

	public ListenerBuilder setOptions(SubscribeOptions options) {
		this.options = options;
		return this;
	}

	public ListenerBuilder setHeartbeatGroup(String heartbeatGroup) {
		this.heartbeatGroup = heartbeatGroup;
		return this;
	}

	public ListenerBuilder setHeartbeatName(String heartbeatName) {
		this.heartbeatName = heartbeatName;
		return this;
	}

	/**
	 * Check with GetTopic that the topic can be subscribed before listening. Enabled by default.
	 */
	public ListenerBuilder setVerifyTopic(boolean verifyTopic) {
		this.verifyTopic = verifyTopic;
		return this;
	}

	public ListenerOrchestrator build() {
		requireNonNull(client, "client");
		requireNonNull(eventHandler, "eventHandler");
		requireNonNull(checkpointStore, "checkpointStore");
		requireNonNull(topic, "topic");
		if (topic.isBlank()) {
			throw new IllegalArgumentException("Topic is blank");
		}
		return new ListenerOrchestrator(client,
				decoder != null ? decoder : new AvroEventDecoder(),
				eventHandler,
				checkpointStore,
				heartbeatStore,
				topic,
				requireNonNull(options, "options"),
				requireNonNull(heartbeatGroup, "heartbeatGroup"),
				heartbeatName != null ? heartbeatName : ListenerOrchestrator.class.getSimpleName(),
				verifyTopic
		);
	}
}
