package it.cavallium.cdclistener.core.client;

import it.cavallium.cdclistener.core.common.ListenerException;
import it.cavallium.cdclistener.core.common.SessionCredentials;
import it.cavallium.cdclistener.core.common.TopicDescription;
import it.cavallium.cdclistener.core.common.cdc.EventBatch;
import it.cavallium.cdclistener.core.common.cdc.FetchParameters;
import it.cavallium.cdclistener.core.common.cdc.ReplayToken;
import it.cavallium.cdclistener.core.common.cdc.SubscribeOptions;
import it.cavallium.cdclistener.core.common.cdc.SubscriptionMode;
import java.io.Closeable;
import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.apache.avro.Schema;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public interface SubscriptionClient extends Closeable {

	/**
	 * Log in and refresh the metadata attached to every call. Safe to call repeatedly.
	 */
	@NotNull
	SessionCredentials auth() throws ListenerException;

	/**
	 * @throws ListenerException with error type {@code SCHEMA_FETCH_ERROR} if the schema can't be fetched or parsed
	 */
	@NotNull
	Schema getSchema(@NotNull String schemaId) throws ListenerException;

	@NotNull
	TopicDescription getTopic(@NotNull String topic) throws ListenerException;

	/**
	 * Stream batches to {@code onBatch} until the client is closed.
	 * <p>
	 * {@code attempts} is called before every (re)connection and gives the parameters of that attempt. Idle timeouts
	 * reconnect immediately, other transport failures reconnect after {@link SubscribeOptions#retryDelay()}.
	 * Exceptions thrown by {@code onBatch} end the subscription and are rethrown.
	 */
	void subscribe(@NotNull Supplier<FetchParameters> attempts,
			@NotNull SubscribeOptions options,
			@NotNull Consumer<EventBatch> onBatch);

	default void subscribe(@NotNull String topic,
			@NotNull SubscriptionMode mode,
			@Nullable ReplayToken token,
			int requestedBatchSize,
			@NotNull Consumer<EventBatch> onBatch,
			@NotNull Duration idleTimeout) {
		var parameters = new FetchParameters(topic, mode, token);
		subscribe(() -> parameters,
				new SubscribeOptions(requestedBatchSize, idleTimeout, SubscribeOptions.DEFAULT_RETRY_DELAY),
				onBatch
		);
	}

	/**
	 * Stop every running subscription. {@link #subscribe} returns after the batch being processed.
	 */
	@Override
	void close();
}
