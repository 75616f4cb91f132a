package it.cavallium.cdclistener.core.impl.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.net.httpserver.HttpServer;
import it.cavallium.cdclistener.core.client.OAuthPasswordAuthenticator;
import it.cavallium.cdclistener.core.common.ListenerException;
import it.cavallium.cdclistener.core.common.ListenerException.ListenerErrorType;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class OAuthPasswordAuthenticatorTest {

	private HttpServer server;
	private final AtomicReference<String> lastForm = new AtomicReference<>();
	private volatile int status;
	private volatile String responseBody;

	@BeforeEach
	public void setUp() throws IOException {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/services/oauth2/token", exchange -> {
			lastForm.set(URLDecoder.decode(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8),
					StandardCharsets.UTF_8));
			var body = responseBody.getBytes(StandardCharsets.UTF_8);
			exchange.getResponseHeaders().add("Content-Type", "application/json");
			exchange.sendResponseHeaders(status, body.length);
			try (var out = exchange.getResponseBody()) {
				out.write(body);
			}
		});
		server.start();
	}

	@AfterEach
	public void tearDown() {
		server.stop(0);
	}

	private OAuthPasswordAuthenticator authenticator(String tenantId) {
		var url = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/services/oauth2/token");
		return new OAuthPasswordAuthenticator(url, "integration@example.com", "pw+token", "client", "secret", tenantId);
	}

	@Test
	public void testPasswordGrant() throws IOException {
		status = 200;
		responseBody = """
				{"access_token":"00D!AQ4AQ","instance_url":"https://example.my.salesforce.com","token_type":"Bearer"}""";
		try (var authenticator = authenticator("00D000000000001")) {
			var credentials = authenticator.authenticate();
			assertEquals("00D!AQ4AQ", credentials.accessToken());
			assertEquals("https://example.my.salesforce.com", credentials.instanceUrl());
			assertEquals("00D000000000001", credentials.tenantId());
		}
		var form = lastForm.get();
		assertTrue(form.contains("grant_type=password"), form);
		assertTrue(form.contains("username=integration@example.com"), form);
		assertTrue(form.contains("password=pw+token"), form);
		assertTrue(form.contains("client_id=client"), form);
		assertTrue(form.contains("client_secret=secret"), form);
	}

	@Test
	public void testWithoutTenant() throws IOException {
		status = 200;
		responseBody = """
				{"access_token":"token","instance_url":"https://example.my.salesforce.com"}""";
		try (var authenticator = authenticator(null)) {
			assertNull(authenticator.authenticate().tenantId());
		}
	}

	@Test
	public void testRejectedLogin() throws IOException {
		status = 400;
		responseBody = """
				{"error":"invalid_grant","error_description":"authentication failure"}""";
		try (var authenticator = authenticator(null)) {
			var ex = assertThrows(ListenerException.class, authenticator::authenticate);
			assertEquals(ListenerErrorType.AUTH_ERROR, ex.getErrorUniqueId());
			assertTrue(ex.getMessage().contains("400"), ex.getMessage());
		}
	}

	@Test
	public void testMissingAccessToken() throws IOException {
		status = 200;
		responseBody = """
				{"instance_url":"https://example.my.salesforce.com"}""";
		try (var authenticator = authenticator(null)) {
			var ex = assertThrows(ListenerException.class, authenticator::authenticate);
			assertEquals(ListenerErrorType.AUTH_ERROR, ex.getErrorUniqueId());
		}
	}
}
