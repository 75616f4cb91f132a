package it.cavallium.cdclistener.core.client;

import io.grpc.ManagedChannel;
import io.grpc.netty.NettyChannelBuilder;
import it.cavallium.cdclistener.core.common.Utils.HostAndPort;
import java.time.Duration;

public class ClientBuilder {

	private static final int MAX_INBOUND_MESSAGE_SIZE = 16 * 1024 * 1024;

	private HostAndPort address;
	private boolean plaintext;
	private ManagedChannel channel;
	private Authenticator authenticator;
	private SchemaCache schemaCache;
	private Duration requestTimeout = Duration.ofSeconds(30);
	private boolean logRequests = true;

	public void setAddress(HostAndPort address) {
		this.address = address;
	}

	public void setPlaintext(boolean plaintext) {
		this.plaintext = plaintext;
	}

	/**
	 * Use an existing channel instead of opening one. The channel is not closed by the client.
	 */
	public void setChannel(ManagedChannel channel) {
		this.channel = channel;
	}

	public void setAuthenticator(Authenticator authenticator) {
		this.authenticator = authenticator;
	}

	/**
	 * Share a schema cache between clients. Each client has its own cache if not set.
	 */
	public void setSchemaCache(SchemaCache schemaCache) {
		this.schemaCache = schemaCache;
	}

	public void setRequestTimeout(Duration requestTimeout) {
		this.requestTimeout = requestTimeout;
	}

	public void setLogRequests(boolean logRequests) {
		this.logRequests = logRequests;
	}

	public SubscriptionClient build() {
		if (authenticator == null) {
			throw new IllegalStateException("Please set an authenticator");
		}
		var cache = schemaCache != null ? schemaCache : new SchemaCache();
		SubscriptionClient client;
		if (channel != null) {
			client = new GrpcSubscriptionClient(channel, false, authenticator, cache, requestTimeout);
		} else if (address != null) {
			var channelBuilder = NettyChannelBuilder
					.forAddress(address.host(), address.port())
					.maxInboundMessageSize(MAX_INBOUND_MESSAGE_SIZE);
			if (plaintext) {
				channelBuilder.usePlaintext();
			} else {
				channelBuilder.useTransportSecurity();
			}
			client = new GrpcSubscriptionClient(channelBuilder.build(), true, authenticator, cache, requestTimeout);
		} else {
			throw new UnsupportedOperationException("Please set a connection type");
		}
		return logRequests ? new LoggingSubscriptionClient(client) : client;
	}
}
