package it.cavallium.cdclistener.core;

import static java.util.Objects.requireNonNull;

import it.cavallium.cdclistener.core.client.ClientBuilder;
import it.cavallium.cdclistener.core.client.OAuthPasswordAuthenticator;
import it.cavallium.cdclistener.core.common.ListenerException;
import it.cavallium.cdclistener.core.common.ReplayCheckpointStore;
import it.cavallium.cdclistener.core.common.Utils;
import it.cavallium.cdclistener.core.common.Utils.HostAndPort;
import it.cavallium.cdclistener.core.common.cdc.ReplayToken;
import it.cavallium.cdclistener.core.common.cdc.SubscribeOptions;
import it.cavallium.cdclistener.core.common.cdc.SubscriptionMode;
import it.cavallium.cdclistener.core.config.CheckpointStoreType;
import it.cavallium.cdclistener.core.config.ConfigParser;
import it.cavallium.cdclistener.core.config.ConfigPrinter;
import it.cavallium.cdclistener.core.config.ListenerConfig;
import it.cavallium.cdclistener.core.impl.LoggingEventHandler;
import it.cavallium.cdclistener.core.impl.store.FileReplayCheckpointStore;
import it.cavallium.cdclistener.core.impl.store.InMemoryReplayCheckpointStore;
import it.cavallium.cdclistener.core.impl.store.LoggingHeartbeatStore;
import it.cavallium.cdclistener.core.listener.ListenerBuilder;
import it.cavallium.cdclistener.core.listener.ListenerOrchestrator;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import org.github.gestalt.config.exceptions.GestaltException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {

	private static final Logger LOG = LoggerFactory.getLogger("cdclistener");

	public static void main(String[] args) throws IOException, URISyntaxException, GestaltException {
		ArgumentParser parser = ArgumentParsers.newFor("cdclistener").build()
				.defaultHelp(true)
				.description("Change data capture listener");
		parser.addArgument("-c", "--config")
				.type(String.class)
				.help("Specify the cdclistener.conf file path");
		parser.addArgument("-u", "--pubsub-url")
				.type(String.class)
				.help("Override the pub/sub endpoint, https://hostname:port or http://hostname:port for plaintext");
		parser.addArgument("-t", "--topic")
				.type(String.class)
				.help("Override the subscribed topic, for example /data/AccountChangeEvent");
		parser.addArgument("-m", "--mode")
				.type(String.class)
				.choices("LATEST", "EARLIEST", "CUSTOM", "latest", "earliest", "custom")
				.help("Override the subscription mode");
		parser.addArgument("-r", "--replay-token")
				.type(String.class)
				.help("Base64 replay token to start from in CUSTOM mode, used only when no checkpoint exists for the topic");
		parser.addArgument("-d", "--checkpoint-dir")
				.type(String.class)
				.help("Override the directory where replay tokens are stored");
		parser.addArgument("-p", "--print-default-config")
				.action(Arguments.storeTrue())
				.help("Print the default configs");
		parser.addArgument("--print-config")
				.action(Arguments.storeTrue())
				.help("Print the effective configs, with secrets masked");
		Namespace ns = null;
		try {
			ns = parser.parseArgs(args);
		} catch (ArgumentParserException e) {
			parser.handleError(e);
			System.exit(1);
		}

		if (ns.getBoolean("print_default_config")) {
			requireNonNull(Main.class.getClassLoader()
					.getResourceAsStream("it/cavallium/cdclistener/core/resources/default.conf"))
					.transferTo(System.out);
			System.exit(0);
			return;
		}

		var rawConfigPath = ns.getString("config");
		ListenerConfig config;
		try {
			config = ConfigParser.parse(rawConfigPath != null ? Path.of(rawConfigPath) : null);
		} catch (ListenerException ex) {
			System.err.println(ex.getLocalizedMessage());
			System.exit(1);
			return;
		}

		if (ns.getBoolean("print_config")) {
			System.out.println(ConfigPrinter.stringify(config));
			System.exit(0);
			return;
		}

		var topic = ns.getString("topic") != null ? ns.getString("topic") : config.subscription().topic();
		var mode = ns.getString("mode") != null
				? SubscriptionMode.valueOf(ns.getString("mode").toUpperCase(Locale.ROOT))
				: config.subscription().mode();
		ReplayToken replayToken = null;
		if (ns.getString("replay_token") != null) {
			try {
				replayToken = ReplayToken.fromBase64(ns.getString("replay_token"));
			} catch (IllegalArgumentException ex) {
				System.err.println("Invalid replay token: " + ex.getMessage());
				System.exit(1);
				return;
			}
		}

		var clientBuilder = new ClientBuilder();
		var rawPubSubUrl = ns.getString("pubsub_url");
		if (rawPubSubUrl != null) {
			var pubSubUrl = new URI(rawPubSubUrl);
			var scheme = pubSubUrl.getScheme();
			switch (scheme == null ? "" : scheme) {
				case "https" -> clientBuilder.setPlaintext(false);
				case "http" -> clientBuilder.setPlaintext(true);
				default -> throw new IllegalArgumentException("Invalid scheme \"" + scheme + "\" for pub/sub url: " + pubSubUrl);
			}
			clientBuilder.setAddress(Utils.parseHostAndPort(pubSubUrl));
		} else {
			clientBuilder.setAddress(new HostAndPort(config.pubsub().host(), config.pubsub().port()));
			clientBuilder.setPlaintext(config.pubsub().plaintext());
		}
		clientBuilder.setRequestTimeout(config.pubsub().requestTimeout());

		var auth = config.auth();
		var tenantId = auth.tenantId();
		var checkpointStore = buildCheckpointStore(config, ns.getString("checkpoint_dir"));

		LOG.info("Starting...");
		boolean failed = false;
		try (var authenticator = new OAuthPasswordAuthenticator(new URI(auth.loginUrl()),
				auth.username(),
				auth.password(),
				auth.clientId(),
				auth.clientSecret(),
				tenantId == null || tenantId.isBlank() ? null : tenantId)) {
			clientBuilder.setAuthenticator(authenticator);

			var subscription = config.subscription();
			var listenerBuilder = new ListenerBuilder()
					.setClient(clientBuilder.build())
					.setEventHandler(new LoggingEventHandler())
					.setCheckpointStore(checkpointStore)
					.setTopic(topic)
					.setOptions(new SubscribeOptions(subscription.batchSize(),
							subscription.idleTimeout(),
							subscription.retryDelay()))
					.setVerifyTopic(subscription.verifyTopic());
			var heartbeat = config.heartbeat();
			if (heartbeat.enabled()) {
				listenerBuilder
						.setHeartbeatStore(new LoggingHeartbeatStore())
						.setHeartbeatGroup(heartbeat.group())
						.setHeartbeatName(heartbeat.name().isBlank() ? config.appName() : heartbeat.name());
			}

			try (var listener = listenerBuilder.build()) {
				CountDownLatch stoppedLatch = new CountDownLatch(1);
				Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(listener, stoppedLatch),
						"Listener shutdown hook"));
				try {
					listener.listen(mode, replayToken);
				} catch (ListenerException ex) {
					LOG.error("Failed to listen to {}", topic, ex);
					failed = true;
				} finally {
					stoppedLatch.countDown();
				}
			}
		}
		if (failed) {
			System.exit(1);
			return;
		}
		LOG.info("Shut down successfully");
	}

	private static ReplayCheckpointStore buildCheckpointStore(ListenerConfig config, String directoryOverride)
			throws GestaltException {
		var checkpoint = config.checkpoint();
		if (directoryOverride != null) {
			return new FileReplayCheckpointStore(Path.of(directoryOverride));
		} else if (checkpoint.type() == CheckpointStoreType.MEMORY) {
			LOG.warn("Replay tokens are kept in memory, the listener will not resume after a restart");
			return new InMemoryReplayCheckpointStore();
		} else {
			return new FileReplayCheckpointStore(checkpoint.directory());
		}
	}

	private static void shutdown(ListenerOrchestrator listener, CountDownLatch stoppedLatch) {
		LOG.info("Shutting down...");
		listener.close();
		try {
			stoppedLatch.await();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}
}
