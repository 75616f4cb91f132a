package it.cavallium.cdclistener.core.client;

import it.cavallium.cdclistener.core.common.ListenerException;
import it.cavallium.cdclistener.core.common.SessionCredentials;
import it.cavallium.cdclistener.core.common.TopicDescription;
import it.cavallium.cdclistener.core.common.cdc.EventBatch;
import it.cavallium.cdclistener.core.common.cdc.FetchParameters;
import it.cavallium.cdclistener.core.common.cdc.SubscribeOptions;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.apache.avro.Schema;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Traces every request and batch of the wrapped client on the {@code listener.requests} logger.
 */
public class LoggingSubscriptionClient implements SubscriptionClient {

	private final SubscriptionClient client;
	private final Logger logger;

	public LoggingSubscriptionClient(SubscriptionClient client) {
		this.client = client;
		this.logger = LoggerFactory.getLogger("listener.requests");
	}

	@Override
	public @NotNull SessionCredentials auth() throws ListenerException {
		logger.trace("Request input: auth");
		try {
			var result = client.auth();
			logger.trace("Request executed: auth    Result: {}", result);
			return result;
		} catch (Throwable e) {
			logger.trace("Request failed: auth    Error: {}", e.getMessage());
			throw e;
		}
	}

	@Override
	public @NotNull Schema getSchema(@NotNull String schemaId) throws ListenerException {
		logger.trace("Request input: getSchema {}", schemaId);
		try {
			var result = client.getSchema(schemaId);
			logger.trace("Request executed: getSchema {}    Result: {}", schemaId, result.getFullName());
			return result;
		} catch (Throwable e) {
			logger.trace("Request failed: getSchema {}    Error: {}", schemaId, e.getMessage());
			throw e;
		}
	}

	@Override
	public @NotNull TopicDescription getTopic(@NotNull String topic) throws ListenerException {
		logger.trace("Request input: getTopic {}", topic);
		try {
			var result = client.getTopic(topic);
			logger.trace("Request executed: getTopic {}    Result: {}", topic, result);
			return result;
		} catch (Throwable e) {
			logger.trace("Request failed: getTopic {}    Error: {}", topic, e.getMessage());
			throw e;
		}
	}

	@Override
	public void subscribe(@NotNull Supplier<FetchParameters> attempts,
			@NotNull SubscribeOptions options,
			@NotNull Consumer<EventBatch> onBatch) {
		if (!logger.isTraceEnabled()) {
			client.subscribe(attempts, options, onBatch);
			return;
		}
		client.subscribe(() -> {
			var parameters = attempts.get();
			logger.trace("Subscribe attempt: {}    Options: {}", parameters, options);
			return parameters;
		}, options, batch -> {
			logger.trace("Batch received: {} events, {} pending, latest replay token {}", batch.events().size(),
					batch.pendingRequestedCount(), batch.latestReplayToken());
			onBatch.accept(batch);
		});
	}

	@Override
	public void close() {
		client.close();
	}
}
