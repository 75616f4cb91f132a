package it.cavallium.cdclistener.core.listener;

import it.cavallium.cdclistener.core.client.SubscriptionClient;
import it.cavallium.cdclistener.core.common.EventHandler;
import it.cavallium.cdclistener.core.common.Heartbeat;
import it.cavallium.cdclistener.core.common.HeartbeatStore;
import it.cavallium.cdclistener.core.common.ListenerException;
import it.cavallium.cdclistener.core.common.ListenerException.ListenerErrorType;
import it.cavallium.cdclistener.core.common.ReplayCheckpointStore;
import it.cavallium.cdclistener.core.common.cdc.EventBatch;
import it.cavallium.cdclistener.core.common.cdc.FetchParameters;
import it.cavallium.cdclistener.core.common.cdc.RawEvent;
import it.cavallium.cdclistener.core.common.cdc.ReplayToken;
import it.cavallium.cdclistener.core.common.cdc.SubscribeOptions;
import it.cavallium.cdclistener.core.common.cdc.SubscriptionMode;
import it.cavallium.cdclistener.core.impl.EventDecoder;
import java.io.Closeable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes one topic: resolves the start position, keeps the subscription alive, dispatches every event to the
 * {@link EventHandler} and saves the replay token of a batch only when all of its events were handled.
 * <p>
 * Delivery is at-least-once. A batch that fails is not checkpointed and is delivered again after the next
 * reconnection or restart.
 */
public class ListenerOrchestrator implements Closeable {

	private static final Logger LOG = LoggerFactory.getLogger(ListenerOrchestrator.class);

	private final SubscriptionClient client;
	private final EventDecoder decoder;
	private final EventHandler eventHandler;
	private final ReplayCheckpointStore checkpointStore;
	@Nullable
	private final HeartbeatStore heartbeatStore;
	private final String topic;
	private final SubscribeOptions options;
	private final String heartbeatGroup;
	private final String heartbeatName;
	private final boolean verifyTopic;

	private volatile ListenerState state = ListenerState.NEW;
	private volatile boolean closed;
	private volatile boolean committedOnce;
	private int attempts;

	ListenerOrchestrator(@NotNull SubscriptionClient client,
			@NotNull EventDecoder decoder,
			@NotNull EventHandler eventHandler,
			@NotNull ReplayCheckpointStore checkpointStore,
			@Nullable HeartbeatStore heartbeatStore,
			@NotNull String topic,
			@NotNull SubscribeOptions options,
			@NotNull String heartbeatGroup,
			@NotNull String heartbeatName,
			boolean verifyTopic) {
		this.client = client;
		this.decoder = decoder;
		this.eventHandler = eventHandler;
		this.checkpointStore = checkpointStore;
		this.heartbeatStore = heartbeatStore;
		this.topic = topic;
		this.options = options;
		this.heartbeatGroup = heartbeatGroup;
		this.heartbeatName = heartbeatName;
		this.verifyTopic = verifyTopic;
	}

	/**
	 * Listen until {@link #close()} is called.
	 *
	 * @param token start position for {@link SubscriptionMode#CUSTOM}, used only while the checkpoint store has no
	 *              token for the topic
	 * @throws ListenerException if the first login fails or the topic can't be subscribed
	 */
	public void listen(@NotNull SubscriptionMode mode, @Nullable ReplayToken token) throws ListenerException {
		var position = selectMode(mode, token);
		client.auth();
		if (verifyTopic) {
			var description = client.getTopic(topic);
			if (!description.canSubscribe()) {
				throw ListenerException.of(ListenerErrorType.TOPIC_NOT_SUBSCRIBABLE,
						"The current user can't subscribe to " + topic);
			}
			LOG.debug("Topic {} uses schema {}", topic, description.schemaId());
		}
		LOG.info("Listening to {} in {} mode from replay token {}", topic, position.mode(), position.token());
		try {
			client.subscribe(() -> nextAttempt(position), options, this::processBatch);
		} finally {
			state = ListenerState.STOPPED;
			LOG.info("Stopped listening to {}", topic);
		}
	}

	/**
	 * Resolve the start position. CUSTOM without a token resumes from the last checkpoint, or from the earliest
	 * retained event if there is none.
	 */
	public ReplayPosition selectMode(@NotNull SubscriptionMode mode, @Nullable ReplayToken token) {
		state = ListenerState.SELECT_MODE;
		if (mode != SubscriptionMode.CUSTOM) {
			return new ReplayPosition(mode, null);
		}
		if (token == null) {
			LOG.info("Attempting to get the replay token of {} from {}", topic, checkpointStore);
			token = checkpointStore.get(topic).orElse(null);
		}
		if (token == null) {
			LOG.info("Changing mode to EARLIEST after not finding any replay token");
			return new ReplayPosition(SubscriptionMode.EARLIEST, null);
		}
		return new ReplayPosition(SubscriptionMode.CUSTOM, token);
	}

	/**
	 * Parameters of the next subscribe attempt. The committed token always wins over the start position, so a
	 * reconnection resumes from the last fully processed batch.
	 */
	FetchParameters nextAttempt(ReplayPosition position) {
		state = attempts++ == 0 ? ListenerState.SUBSCRIBE : ListenerState.RECONNECT;
		writeHeartbeat();
		var committed = checkpointStore.get(topic);
		if (position.mode() == SubscriptionMode.CUSTOM) {
			return new FetchParameters(topic, SubscriptionMode.CUSTOM, committed.orElse(position.token()));
		}
		if (committedOnce && committed.isPresent()) {
			return new FetchParameters(topic, SubscriptionMode.CUSTOM, committed.get());
		}
		return new FetchParameters(topic, position.mode(), null);
	}

	private void writeHeartbeat() {
		if (heartbeatStore == null) {
			return;
		}
		var heartbeat = Heartbeat.now(heartbeatGroup, heartbeatName, "HEARTBEAT => " + getClass().getSimpleName()
				+ " consuming " + topic + " events; using event handler " + eventHandler);
		try {
			LOG.debug("About to save heartbeat to {}: {}", heartbeatStore, heartbeat);
			heartbeatStore.put(heartbeat);
		} catch (RuntimeException ex) {
			LOG.error("Failed to save heartbeat {}", heartbeat, ex);
		}
	}

	/**
	 * Dispatch every event of the batch in order, then save the batch replay token if none failed.
	 * A failed event does not stop the following ones.
	 */
	public BatchResult processBatch(@NotNull EventBatch batch) {
		if (closed) {
			LOG.debug("Listener closed, leaving batch of {} events to the next run", batch.events().size());
			return new BatchResult(0, 0, false);
		}
		state = ListenerState.PROCESS_BATCH;
		if (!batch.isKeepAlive()) {
			LOG.info("Received {} events from {}", batch.events().size(), topic);
		}
		int failed = 0;
		for (RawEvent event : batch.events()) {
			if (!processEvent(event)) {
				failed++;
			}
		}

		state = ListenerState.CHECKPOINT;
		var token = batch.latestReplayToken();
		boolean checkpointed = false;
		if (failed > 0) {
			LOG.warn("Processing failed for {} of {} events! Not saving replay token {}", failed,
					batch.events().size(), token);
		} else if (token != null) {
			try {
				checkpointStore.put(topic, token);
				checkpointed = true;
				committedOnce = true;
				if (batch.isKeepAlive()) {
					LOG.debug("Saved keep-alive replay token {}", token);
				} else {
					LOG.info("Successfully processed {} events. Saved replay token {}", batch.events().size(), token);
				}
			} catch (RuntimeException ex) {
				LOG.error("Exception while saving replay token {}", token, ex);
			}
		}
		return new BatchResult(batch.events().size(), failed, checkpointed);
	}

	private boolean processEvent(RawEvent event) {
		try {
			LOG.debug("Processing {}", event);
			var schema = client.getSchema(event.schemaId());
			var decoded = decoder.decode(event.schemaId(), schema, event.payload());
			if (!eventHandler.handle(decoded)) {
				LOG.warn("Event handler {} failed to handle {}", eventHandler, event);
				return false;
			}
			return true;
		} catch (ListenerException ex) {
			LOG.error("Can't process {}: {}", event, ex.getLocalizedMessage(), ex);
			return false;
		} catch (RuntimeException ex) {
			LOG.error("Exception in event handler {} while processing {}", eventHandler, event, ex);
			return false;
		}
	}

	public ListenerState getState() {
		return state;
	}

	/**
	 * Stop listening. The batch being processed is completed first.
	 */
	@Override
	public void close() {
		if (closed) {
			return;
		}
		closed = true;
		LOG.info("Closing listener of {}", topic);
		client.close();
	}
}
