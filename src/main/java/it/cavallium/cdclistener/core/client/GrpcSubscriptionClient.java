package it.cavallium.cdclistener.core.client;

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.protobuf.UnsafeByteOperations;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.Status.Code;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientResponseObserver;
import io.grpc.stub.MetadataUtils;
import io.grpc.stub.StreamObserver;
import it.cavallium.cdclistener.core.common.ListenerException;
import it.cavallium.cdclistener.core.common.ListenerException.ListenerErrorType;
import it.cavallium.cdclistener.core.common.SessionCredentials;
import it.cavallium.cdclistener.core.common.TopicDescription;
import it.cavallium.cdclistener.core.common.Utils;
import it.cavallium.cdclistener.core.common.api.proto.ConsumerEvent;
import it.cavallium.cdclistener.core.common.api.proto.FetchRequest;
import it.cavallium.cdclistener.core.common.api.proto.FetchResponse;
import it.cavallium.cdclistener.core.common.api.proto.PubSubGrpc;
import it.cavallium.cdclistener.core.common.api.proto.PubSubGrpc.PubSubFutureStub;
import it.cavallium.cdclistener.core.common.api.proto.PubSubGrpc.PubSubStub;
import it.cavallium.cdclistener.core.common.api.proto.ReplayPreset;
import it.cavallium.cdclistener.core.common.api.proto.SchemaInfo;
import it.cavallium.cdclistener.core.common.api.proto.SchemaRequest;
import it.cavallium.cdclistener.core.common.api.proto.TopicInfo;
import it.cavallium.cdclistener.core.common.api.proto.TopicRequest;
import it.cavallium.cdclistener.core.common.cdc.EventBatch;
import it.cavallium.cdclistener.core.common.cdc.FetchParameters;
import it.cavallium.cdclistener.core.common.cdc.RawEvent;
import it.cavallium.cdclistener.core.common.cdc.ReplayToken;
import it.cavallium.cdclistener.core.common.cdc.SubscribeOptions;
import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import org.apache.avro.Schema;
import org.apache.avro.SchemaParseException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pub/Sub API client over gRPC.
 * <p>
 * Every subscribe attempt opens one bidirectional stream. A sender thread writes a fetch request each time it
 * obtains the {@link FlowControlPermit}, the calling thread consumes the responses and gives the permit back when a
 * response reports no pending requested events, so at most one fetch request is outstanding.
 */
public class GrpcSubscriptionClient implements SubscriptionClient {

	private static final Logger LOG = LoggerFactory.getLogger(GrpcSubscriptionClient.class);

	private static final Metadata.Key<String> ACCESS_TOKEN_KEY
			= Metadata.Key.of("accesstoken", Metadata.ASCII_STRING_MARSHALLER);
	private static final Metadata.Key<String> INSTANCE_URL_KEY
			= Metadata.Key.of("instanceurl", Metadata.ASCII_STRING_MARSHALLER);
	private static final Metadata.Key<String> TENANT_ID_KEY
			= Metadata.Key.of("tenantid", Metadata.ASCII_STRING_MARSHALLER);

	private static final long POLL_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(100);

	private final ManagedChannel channel;
	private final boolean ownsChannel;
	private final Authenticator authenticator;
	private final SchemaCache schemaCache;
	private final Duration requestTimeout;
	private final PubSubStub asyncStub;
	private final PubSubFutureStub futureStub;
	private final ExecutorService senderExecutor;

	private volatile Metadata callMetadata;
	private volatile FetchResponseObserver activeStream;
	private volatile boolean closed;

	public GrpcSubscriptionClient(@NotNull ManagedChannel channel,
			boolean ownsChannel,
			@NotNull Authenticator authenticator,
			@NotNull SchemaCache schemaCache,
			@NotNull Duration requestTimeout) {
		this.channel = channel;
		this.ownsChannel = ownsChannel;
		this.authenticator = authenticator;
		this.schemaCache = schemaCache;
		this.requestTimeout = requestTimeout;
		this.asyncStub = PubSubGrpc.newStub(channel);
		this.futureStub = PubSubGrpc.newFutureStub(channel);
		this.senderExecutor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
				.setNameFormat("fetch-sender-%d")
				.setDaemon(true)
				.build());
	}

	@Override
	public @NotNull SessionCredentials auth() throws ListenerException {
		var credentials = authenticator.authenticate();
		var metadata = new Metadata();
		metadata.put(ACCESS_TOKEN_KEY, credentials.accessToken());
		metadata.put(INSTANCE_URL_KEY, credentials.instanceUrl());
		if (credentials.tenantId() != null) {
			metadata.put(TENANT_ID_KEY, credentials.tenantId());
		}
		this.callMetadata = metadata;
		LOG.debug("Authenticated: {}", credentials);
		return credentials;
	}

	@Override
	public @NotNull Schema getSchema(@NotNull String schemaId) throws ListenerException {
		return schemaCache.get(schemaId, this::fetchSchema);
	}

	private Schema fetchSchema(String schemaId) {
		LOG.debug("Fetching schema {}", schemaId);
		var request = SchemaRequest.newBuilder().setSchemaId(schemaId).build();
		var response = toResponse(authenticatedFutureStub().getSchema(request), SchemaInfo::getSchemaJson);
		var schemaJson = await(response, ListenerErrorType.SCHEMA_FETCH_ERROR, "GetSchema " + schemaId);
		try {
			return new Schema.Parser().parse(schemaJson);
		} catch (SchemaParseException ex) {
			throw ListenerException.of(ListenerErrorType.SCHEMA_FETCH_ERROR, "Invalid schema " + schemaId, ex);
		}
	}

	@Override
	public @NotNull TopicDescription getTopic(@NotNull String topic) throws ListenerException {
		var request = TopicRequest.newBuilder().setTopicName(topic).build();
		var response = toResponse(authenticatedFutureStub().getTopic(request), GrpcSubscriptionClient::mapTopicInfo);
		return await(response, ListenerErrorType.TRANSPORT_ERROR, "GetTopic " + topic);
	}

	@Override
	public void subscribe(@NotNull Supplier<FetchParameters> attempts,
			@NotNull SubscribeOptions options,
			@NotNull Consumer<EventBatch> onBatch) {
		while (!closed) {
			String topic = null;
			try {
				var parameters = attempts.get();
				topic = parameters.topic();
				LOG.debug("Subscribing to {} in {} mode from replay token {}", topic, parameters.mode(),
						parameters.token());
				var end = streamOnce(parameters, options, onBatch);
				if (end == StreamEnd.CLOSED) {
					break;
				}
				LOG.debug("No events received in {}, reconnecting to {}", options.idleTimeout(), topic);
				continue;
			} catch (BatchCallbackException ex) {
				throw ex.callbackException;
			} catch (ListenerException ex) {
				switch (ex.getErrorUniqueId()) {
					case IDLE_TIMEOUT -> {
						LOG.debug("Subscription to {} timed out, reconnecting", topic);
						continue;
					}
					case AUTH_ERROR -> {
						LOG.warn("Session of subscription to {} was rejected, authenticating again", topic);
						reauthenticate();
					}
					default -> LOG.error("Subscription to {} failed: {}", topic, ex.getLocalizedMessage());
				}
			}
			if (!closed && !Utils.sleep(options.retryDelay())) {
				break;
			}
		}
		LOG.debug("Subscription loop ended");
	}

	private void reauthenticate() {
		try {
			auth();
		} catch (ListenerException authEx) {
			LOG.error("Authentication failed, retrying later: {}", authEx.getLocalizedMessage());
		}
	}

	private StreamEnd streamOnce(FetchParameters parameters, SubscribeOptions options, Consumer<EventBatch> onBatch) {
		var permit = new FlowControlPermit();
		var responses = new FetchResponseObserver();
		StreamObserver<FetchRequest> requests = authenticatedAsyncStub().subscribe(responses);
		activeStream = responses;
		var fetchRequest = toFetchRequest(parameters, options.batchSize());
		Future<?> sender;
		try {
			sender = senderExecutor.submit(() -> sendFetchRequests(permit, requests, fetchRequest));
		} catch (RejectedExecutionException ex) {
			responses.cancel("Client closed");
			activeStream = null;
			return StreamEnd.CLOSED;
		}
		try {
			long idleTimeoutNanos = options.idleTimeout().toNanos();
			long lastEventNanos = System.nanoTime();
			while (true) {
				if (closed) {
					return StreamEnd.CLOSED;
				}
				long remainingNanos = idleTimeoutNanos - (System.nanoTime() - lastEventNanos);
				if (remainingNanos <= 0L) {
					return StreamEnd.IDLE_TIMEOUT;
				}
				var signal = responses.signals.poll(Math.min(remainingNanos, POLL_SLICE_NANOS), TimeUnit.NANOSECONDS);
				if (signal == null || closed) {
					continue;
				}
				if (signal.error() != null) {
					throw mapTransportError(signal.error());
				}
				if (signal.response() == null) {
					throw ListenerException.of(ListenerErrorType.TRANSPORT_ERROR, "The server closed the stream");
				}
				var batch = toEventBatch(signal.response());
				try {
					onBatch.accept(batch);
				} catch (RuntimeException ex) {
					throw new BatchCallbackException(ex);
				}
				// Time spent in the callback is not idle time
				if (!batch.isKeepAlive()) {
					lastEventNanos = System.nanoTime();
				}
				if (batch.isFullyDelivered()) {
					permit.release();
				}
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return StreamEnd.CLOSED;
		} finally {
			sender.cancel(true);
			responses.cancel("Subscription attempt ended");
			activeStream = null;
		}
	}

	private static void sendFetchRequests(FlowControlPermit permit,
			StreamObserver<FetchRequest> requests,
			FetchRequest fetchRequest) {
		try {
			while (!Thread.currentThread().isInterrupted()) {
				permit.acquire();
				LOG.debug("Sending fetch request for {} events of {}", fetchRequest.getNumRequested(),
						fetchRequest.getTopicName());
				requests.onNext(fetchRequest);
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		} catch (RuntimeException e) {
			LOG.debug("Fetch request sender stopped: {}", e.toString());
		}
	}

	private static FetchRequest toFetchRequest(FetchParameters parameters, int batchSize) {
		var builder = FetchRequest.newBuilder()
				.setTopicName(parameters.topic())
				.setReplayPreset(switch (parameters.mode()) {
					case LATEST -> ReplayPreset.LATEST;
					case EARLIEST -> ReplayPreset.EARLIEST;
					case CUSTOM -> ReplayPreset.CUSTOM;
				})
				.setNumRequested(batchSize);
		if (parameters.token() != null) {
			builder.setReplayId(UnsafeByteOperations.unsafeWrap(parameters.token().toByteArray()));
		}
		return builder.build();
	}

	private static EventBatch toEventBatch(FetchResponse response) {
		var events = new ArrayList<RawEvent>(response.getEventsCount());
		for (ConsumerEvent consumerEvent : response.getEventsList()) {
			var event = consumerEvent.getEvent();
			events.add(new RawEvent(event.getSchemaId(),
					event.getPayload().toByteArray(),
					event.getId().isEmpty() ? null : event.getId(),
					ReplayToken.ofNullable(consumerEvent.getReplayId().toByteArray())
			));
		}
		return new EventBatch(events,
				response.getPendingNumRequested(),
				ReplayToken.ofNullable(response.getLatestReplayId().toByteArray())
		);
	}

	private static TopicDescription mapTopicInfo(TopicInfo topicInfo) {
		return new TopicDescription(topicInfo.getTopicName(),
				topicInfo.getSchemaId().isEmpty() ? null : topicInfo.getSchemaId(),
				topicInfo.getCanSubscribe()
		);
	}

	private PubSubStub authenticatedAsyncStub() {
		return asyncStub.withInterceptors(MetadataUtils.newAttachHeadersInterceptor(requireMetadata()));
	}

	private PubSubFutureStub authenticatedFutureStub() {
		return futureStub
				.withInterceptors(MetadataUtils.newAttachHeadersInterceptor(requireMetadata()))
				.withDeadlineAfter(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
	}

	private Metadata requireMetadata() {
		var metadata = this.callMetadata;
		if (metadata == null) {
			auth();
			metadata = this.callMetadata;
		}
		return metadata;
	}

	static ListenerException mapTransportError(@NotNull Throwable t) {
		if (t instanceof CompletionException && t.getCause() != null) {
			return mapTransportError(t.getCause());
		}
		if (t instanceof ListenerException listenerException) {
			return listenerException;
		}
		Status status;
		if (t instanceof StatusRuntimeException statusRuntimeException) {
			status = statusRuntimeException.getStatus();
		} else if (t instanceof StatusException statusException) {
			status = statusException.getStatus();
		} else {
			return ListenerException.of(ListenerErrorType.TRANSPORT_ERROR, t);
		}
		var message = "gRPC error " + status.getCode() + ": " + status.getDescription();
		if (status.getCode() == Code.DEADLINE_EXCEEDED) {
			return ListenerException.of(ListenerErrorType.IDLE_TIMEOUT, message, t);
		} else if (status.getCode() == Code.UNAUTHENTICATED) {
			return ListenerException.of(ListenerErrorType.AUTH_ERROR, message, t);
		} else {
			return ListenerException.of(ListenerErrorType.TRANSPORT_ERROR, message, t);
		}
	}

	private static <T> T await(CompletableFuture<T> future, ListenerErrorType errorType, String requestName) {
		try {
			return future.join();
		} catch (CompletionException ex) {
			var mapped = mapTransportError(ex);
			if (mapped.getErrorUniqueId() == errorType) {
				throw mapped;
			}
			throw ListenerException.of(errorType, requestName + " failed: " + mapped.getMessage(), mapped);
		}
	}

	private static <T, U> CompletableFuture<U> toResponse(ListenableFuture<T> listenableFuture,
			Function<T, U> mapper) {
		var cf = new CompletableFuture<U>() {
			@Override
			public boolean cancel(boolean mayInterruptIfRunning) {
				boolean cancelled = listenableFuture.cancel(mayInterruptIfRunning);
				super.cancel(cancelled);
				return cancelled;
			}
		};

		Futures.addCallback(listenableFuture, new FutureCallback<>() {
			@Override
			public void onSuccess(T result) {
				try {
					cf.complete(mapper.apply(result));
				} catch (RuntimeException ex) {
					cf.completeExceptionally(ex);
				}
			}

			@Override
			public void onFailure(@NotNull Throwable t) {
				cf.completeExceptionally(t);
			}
		}, MoreExecutors.directExecutor());

		return cf;
	}

	@Override
	public void close() {
		closed = true;
		var stream = activeStream;
		if (stream != null) {
			stream.cancel("Client closed");
		}
		senderExecutor.shutdownNow();
		if (ownsChannel) {
			try {
				channel.shutdown();
			} catch (Exception ex) {
				LOG.error("Failed to close channel", ex);
			}
			try {
				if (!channel.awaitTermination(1, TimeUnit.MINUTES)) {
					channel.shutdownNow();
				}
			} catch (InterruptedException e) {
				LOG.error("Failed to wait channel termination", e);
				channel.shutdownNow();
				Thread.currentThread().interrupt();
			}
		}
	}

	private enum StreamEnd {
		IDLE_TIMEOUT,
		CLOSED
	}

	private static final class BatchCallbackException extends RuntimeException {

		private final RuntimeException callbackException;

		BatchCallbackException(RuntimeException callbackException) {
			super(callbackException);
			this.callbackException = callbackException;
		}
	}

	private record StreamSignal(@Nullable FetchResponse response, @Nullable Throwable error) {}

	private static final class FetchResponseObserver implements ClientResponseObserver<FetchRequest, FetchResponse> {

		private final BlockingQueue<StreamSignal> signals = new LinkedBlockingQueue<>();
		private volatile ClientCallStreamObserver<FetchRequest> requestStream;

		@Override
		public void beforeStart(ClientCallStreamObserver<FetchRequest> requestStream) {
			this.requestStream = requestStream;
		}

		@Override
		public void onNext(FetchResponse response) {
			signals.add(new StreamSignal(response, null));
		}

		@Override
		public void onError(Throwable throwable) {
			signals.add(new StreamSignal(null, throwable));
		}

		@Override
		public void onCompleted() {
			signals.add(new StreamSignal(null, null));
		}

		void cancel(String message) {
			var stream = requestStream;
			if (stream != null) {
				stream.cancel(message, null);
			}
		}
	}
}
