package it.cavallium.cdclistener.core.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.Status;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import it.cavallium.cdclistener.core.client.ClientBuilder;
import it.cavallium.cdclistener.core.client.GrpcSubscriptionClient;
import it.cavallium.cdclistener.core.client.LoggingSubscriptionClient;
import it.cavallium.cdclistener.core.client.SchemaCache;
import it.cavallium.cdclistener.core.common.ListenerException;
import it.cavallium.cdclistener.core.common.ListenerException.ListenerErrorType;
import it.cavallium.cdclistener.core.common.SessionCredentials;
import it.cavallium.cdclistener.core.common.api.proto.ReplayPreset;
import it.cavallium.cdclistener.core.common.cdc.EventBatch;
import it.cavallium.cdclistener.core.common.cdc.FetchParameters;
import it.cavallium.cdclistener.core.common.cdc.ReplayToken;
import it.cavallium.cdclistener.core.common.cdc.SubscribeOptions;
import it.cavallium.cdclistener.core.common.cdc.SubscriptionMode;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(20)
public class GrpcSubscriptionClientTest {

	private static final String TOPIC = "/data/AccountChangeEvent";
	private static final Metadata.Key<String> ACCESS_TOKEN = Metadata.Key.of("accesstoken",
			Metadata.ASCII_STRING_MARSHALLER);
	private static final Metadata.Key<String> INSTANCE_URL = Metadata.Key.of("instanceurl",
			Metadata.ASCII_STRING_MARSHALLER);
	private static final Metadata.Key<String> TENANT_ID = Metadata.Key.of("tenantid", Metadata.ASCII_STRING_MARSHALLER);

	private FakePubSubService service;
	private Server server;
	private ManagedChannel channel;
	private GrpcSubscriptionClient client;
	private final AtomicInteger authCalls = new AtomicInteger();

	@BeforeEach
	public void setUp() throws IOException {
		var name = InProcessServerBuilder.generateName();
		service = new FakePubSubService();
		server = InProcessServerBuilder.forName(name)
				.directExecutor()
				.addService(ServerInterceptors.intercept(service, service.headerCapture()))
				.build()
				.start();
		channel = InProcessChannelBuilder.forName(name).directExecutor().build();
		client = new GrpcSubscriptionClient(channel, false, () -> new SessionCredentials(
				"token-" + authCalls.incrementAndGet(),
				"https://example.my.salesforce.com",
				"00D000000000001"
		), new SchemaCache(), Duration.ofSeconds(5));
	}

	@AfterEach
	public void tearDown() throws InterruptedException {
		client.close();
		channel.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
		server.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
	}

	@Test
	public void testSessionHeaders() {
		var topic = client.getTopic(TOPIC);
		assertEquals(TOPIC, topic.topicName());
		assertEquals(TestEvents.SCHEMA_ID, topic.schemaId());
		assertTrue(topic.canSubscribe());

		var headers = service.headers.get(0);
		assertEquals("token-1", headers.get(ACCESS_TOKEN));
		assertEquals("https://example.my.salesforce.com", headers.get(INSTANCE_URL));
		assertEquals("00D000000000001", headers.get(TENANT_ID));
	}

	@Test
	public void testSchemaIsFetchedOnce() {
		service.schemas.put(TestEvents.SCHEMA_ID, TestEvents.ACCOUNT_SCHEMA.toString());
		var first = client.getSchema(TestEvents.SCHEMA_ID);
		var second = client.getSchema(TestEvents.SCHEMA_ID);
		assertSame(first, second);
		assertEquals(TestEvents.ACCOUNT_SCHEMA, first);
		assertEquals(1, service.schemaCalls.get());
	}

	@Test
	public void testSchemaErrors() {
		service.schemas.put("invalid", "{\"type\": \"nope\"}");
		var invalid = assertThrows(ListenerException.class, () -> client.getSchema("invalid"));
		assertEquals(ListenerErrorType.SCHEMA_FETCH_ERROR, invalid.getErrorUniqueId());
		var missing = assertThrows(ListenerException.class, () -> client.getSchema("missing"));
		assertEquals(ListenerErrorType.SCHEMA_FETCH_ERROR, missing.getErrorUniqueId());
	}

	@Test
	public void testOneFetchRequestOutstanding() {
		var outstanding = new AtomicInteger();
		var maxOutstanding = new AtomicInteger();
		var sequence = new AtomicInteger();
		service.onFetch = (request, responses) -> {
			maxOutstanding.accumulateAndGet(outstanding.incrementAndGet(), Math::max);
			// Two events for each request, delivered in two responses
			int first = sequence.incrementAndGet();
			responses.onNext(FakePubSubService.response(1, new byte[] {(byte) first},
					FakePubSubService.event("e" + first, new byte[] {1}, new byte[] {(byte) first})));
			int second = sequence.incrementAndGet();
			outstanding.decrementAndGet();
			responses.onNext(FakePubSubService.response(0, new byte[] {(byte) second},
					FakePubSubService.event("e" + second, new byte[] {1}, new byte[] {(byte) second})));
		};
		var batches = new CopyOnWriteArrayList<EventBatch>();
		client.subscribe(() -> new FetchParameters(TOPIC, SubscriptionMode.EARLIEST, null),
				new SubscribeOptions(2, Duration.ofSeconds(10), Duration.ofMillis(10)),
				batch -> {
					batches.add(batch);
					if (batches.size() == 6) {
						client.close();
					}
				});

		assertEquals(6, batches.size());
		assertEquals(1, maxOutstanding.get());
		assertEquals(1, batches.get(0).pendingRequestedCount());
		assertEquals(0, batches.get(1).pendingRequestedCount());
		assertEquals("e1", batches.get(0).events().get(0).eventId());
		assertEquals(ReplayToken.of(new byte[] {6}), batches.get(5).latestReplayToken());
		assertTrue(service.fetchRequests.size() >= 3);
		for (var request : service.fetchRequests) {
			assertEquals(TOPIC, request.getTopicName());
			assertEquals(ReplayPreset.EARLIEST, request.getReplayPreset());
			assertEquals(2, request.getNumRequested());
			assertTrue(request.getReplayId().isEmpty());
		}
	}

	@Test
	public void testWaitsForPendingEvents() throws Exception {
		service.onFetch = (request, responses) -> responses.onNext(FakePubSubService.response(1, new byte[] {1},
				FakePubSubService.event("e1", new byte[] {1}, new byte[] {1})));
		var batches = new CopyOnWriteArrayList<EventBatch>();
		var subscription = CompletableFuture.runAsync(() -> client.subscribe(TOPIC,
				SubscriptionMode.LATEST,
				null,
				2,
				batches::add,
				Duration.ofSeconds(10)
		));
		awaitCondition(() -> batches.size() == 1);
		Thread.sleep(300);
		assertEquals(1, service.fetchRequests.size());
		assertEquals(ReplayPreset.LATEST, service.fetchRequests.get(0).getReplayPreset());

		client.close();
		subscription.get(5, TimeUnit.SECONDS);
		assertEquals(1, service.fetchRequests.size());
	}

	@Test
	public void testIdleTimeoutReconnectsWithSameParameters() throws Exception {
		var token = ReplayToken.of(new byte[] {0, 0, 0, 42});
		var attempts = new AtomicInteger();
		var subscription = CompletableFuture.runAsync(() -> client.subscribe(() -> {
					attempts.incrementAndGet();
					return new FetchParameters(TOPIC, SubscriptionMode.CUSTOM, token);
				},
				new SubscribeOptions(5, Duration.ofMillis(200), Duration.ofSeconds(30)),
				batch -> {}));
		awaitCondition(() -> service.subscribeCalls.get() >= 3);
		client.close();
		subscription.get(5, TimeUnit.SECONDS);

		// Idle reconnections skip the retry delay
		assertTrue(attempts.get() >= 3);
		for (var request : service.fetchRequests) {
			assertEquals(ReplayPreset.CUSTOM, request.getReplayPreset());
			assertEquals(List.of((byte) 0, (byte) 0, (byte) 0, (byte) 42), toList(request.getReplayId().toByteArray()));
			assertEquals(5, request.getNumRequested());
		}
	}

	@Test
	public void testKeepAlivesDoNotResetIdleTimer() throws Exception {
		service.onFetch = (request, responses) -> responses.onNext(FakePubSubService.response(5, new byte[] {7}));
		var batches = new CopyOnWriteArrayList<EventBatch>();
		var subscription = CompletableFuture.runAsync(() -> client.subscribe(
				() -> new FetchParameters(TOPIC, SubscriptionMode.LATEST, null),
				new SubscribeOptions(5, Duration.ofMillis(200), Duration.ofSeconds(30)),
				batches::add));
		awaitCondition(() -> service.subscribeCalls.get() >= 2);
		client.close();
		subscription.get(5, TimeUnit.SECONDS);

		assertTrue(batches.get(0).isKeepAlive());
		assertEquals(ReplayToken.of(new byte[] {7}), batches.get(0).latestReplayToken());
	}

	@Test
	public void testUnauthenticatedStreamAuthenticatesAgain() throws Exception {
		service.onFetch = (request, responses) -> responses.onError(Status.UNAUTHENTICATED
				.withDescription("session expired")
				.asRuntimeException());
		var subscription = CompletableFuture.runAsync(() -> client.subscribe(
				() -> new FetchParameters(TOPIC, SubscriptionMode.LATEST, null),
				new SubscribeOptions(1, Duration.ofSeconds(10), Duration.ofMillis(10)),
				batch -> {}));
		awaitCondition(() -> service.subscribeCalls.get() >= 2);
		client.close();
		subscription.get(5, TimeUnit.SECONDS);

		assertTrue(authCalls.get() >= 2);
		var lastHeaders = service.headers.get(service.headers.size() - 1);
		assertNotNull(lastHeaders.get(ACCESS_TOKEN));
		assertNotEquals("token-1", lastHeaders.get(ACCESS_TOKEN));
	}

	@Test
	@DisplayName("Transport failures and stream completion are retried, deadlines reconnect immediately")
	public void testTransportFailuresAreRetried() {
		var retryDelay = Duration.ofMillis(200);
		service.onFetch = (request, responses) -> {
			switch (service.subscribeCalls.get()) {
				case 1 -> responses.onError(Status.UNAVAILABLE.withDescription("server restarting").asRuntimeException());
				case 2 -> responses.onError(Status.DEADLINE_EXCEEDED.asRuntimeException());
				case 3 -> responses.onCompleted();
				default -> responses.onNext(FakePubSubService.response(0, new byte[] {4},
						FakePubSubService.event("e4", new byte[] {1}, new byte[] {4})));
			}
		};
		var batches = new CopyOnWriteArrayList<EventBatch>();
		long start = System.nanoTime();
		client.subscribe(() -> new FetchParameters(TOPIC, SubscriptionMode.LATEST, null),
				new SubscribeOptions(1, Duration.ofSeconds(10), retryDelay),
				batch -> {
					batches.add(batch);
					client.close();
				});
		var elapsed = Duration.ofNanos(System.nanoTime() - start);

		assertEquals(4, service.subscribeCalls.get());
		assertEquals(1, batches.size());
		assertEquals("e4", batches.get(0).events().get(0).eventId());
		// Only UNAVAILABLE and the completed stream wait before reconnecting
		assertTrue(elapsed.compareTo(retryDelay.multipliedBy(2)) >= 0, elapsed.toString());
		assertTrue(elapsed.compareTo(retryDelay.multipliedBy(3).plus(Duration.ofSeconds(5))) < 0, elapsed.toString());
	}

	@Test
	@DisplayName("Time spent handling a batch does not count as idle time")
	public void testSlowBatchDoesNotTriggerIdleTimeout() throws Exception {
		service.onFetch = (request, responses) -> {
			responses.onNext(FakePubSubService.response(1, new byte[] {1},
					FakePubSubService.event("e1", new byte[] {1}, new byte[] {1})));
			responses.onNext(FakePubSubService.response(0, new byte[] {2},
					FakePubSubService.event("e2", new byte[] {1}, new byte[] {2})));
		};
		var batches = new CopyOnWriteArrayList<EventBatch>();
		client.subscribe(() -> new FetchParameters(TOPIC, SubscriptionMode.LATEST, null),
				new SubscribeOptions(2, Duration.ofMillis(200), Duration.ofMillis(10)),
				batch -> {
					batches.add(batch);
					if (batches.size() == 1) {
						try {
							Thread.sleep(400);
						} catch (InterruptedException e) {
							throw new IllegalStateException(e);
						}
					} else {
						client.close();
					}
				});

		assertEquals(1, service.subscribeCalls.get());
		assertEquals(2, batches.size());
		assertEquals("e1", batches.get(0).events().get(0).eventId());
		assertEquals("e2", batches.get(1).events().get(0).eventId());
	}

	@Test
	public void testBatchCallbackExceptionEndsSubscription() {
		service.onFetch = (request, responses) -> responses.onNext(FakePubSubService.response(0, new byte[] {1},
				FakePubSubService.event("e1", new byte[] {1}, new byte[] {1})));
		var ex = assertThrows(IllegalStateException.class, () -> client.subscribe(
				() -> new FetchParameters(TOPIC, SubscriptionMode.LATEST, null),
				new SubscribeOptions(1, Duration.ofSeconds(10), Duration.ofMillis(10)),
				batch -> {
					throw new IllegalStateException("handler bug");
				}));
		assertEquals("handler bug", ex.getMessage());
		assertEquals(1, service.subscribeCalls.get());
	}

	@Test
	public void testClientBuilderWithSharedChannel() {
		var cache = new SchemaCache();
		var builder = new ClientBuilder();
		builder.setChannel(channel);
		builder.setAuthenticator(() -> new SessionCredentials("shared", "https://example.my.salesforce.com", null));
		builder.setSchemaCache(cache);
		builder.setLogRequests(true);
		service.schemas.put(TestEvents.SCHEMA_ID, TestEvents.ACCOUNT_SCHEMA.toString());

		var built = builder.build();
		assertTrue(built instanceof LoggingSubscriptionClient);
		built.getSchema(TestEvents.SCHEMA_ID);
		assertTrue(cache.getIfPresent(TestEvents.SCHEMA_ID).isPresent());
		assertEquals("shared", service.headers.get(0).get(ACCESS_TOKEN));
		assertNull(service.headers.get(0).get(TENANT_ID));

		// The channel is not owned by the built client
		built.close();
		assertFalse(channel.isShutdown());
	}

	@Test
	public void testClientBuilderRequiresAuthenticator() {
		var builder = new ClientBuilder();
		builder.setChannel(channel);
		assertThrows(IllegalStateException.class, builder::build);
	}

	private static List<Byte> toList(byte[] bytes) {
		var list = new ArrayList<Byte>(bytes.length);
		for (byte b : bytes) {
			list.add(b);
		}
		return list;
	}

	private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
		long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
		while (!condition.getAsBoolean()) {
			if (System.nanoTime() > deadline) {
				throw new AssertionError("Condition not met in time");
			}
			Thread.sleep(10);
		}
	}
}
