package it.cavallium.cdclistener.core.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.cavallium.cdclistener.core.common.ListenerException;
import it.cavallium.cdclistener.core.common.ListenerException.ListenerErrorType;
import it.cavallium.cdclistener.core.common.SessionCredentials;
import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.entity.UrlEncodedFormEntity;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.message.BasicNameValuePair;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OAuth 2.0 username-password flow. Can be called any number of times, each call opens a new session.
 */
public class OAuthPasswordAuthenticator implements Authenticator, Closeable {

	private static final Logger LOG = LoggerFactory.getLogger(OAuthPasswordAuthenticator.class);
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final URI loginUrl;
	private final String username;
	private final String password;
	private final String clientId;
	private final String clientSecret;
	@Nullable
	private final String tenantId;
	private final CloseableHttpClient httpClient;

	public OAuthPasswordAuthenticator(@NotNull URI loginUrl,
			@NotNull String username,
			@NotNull String password,
			@NotNull String clientId,
			@NotNull String clientSecret,
			@Nullable String tenantId) {
		this.loginUrl = loginUrl;
		this.username = username;
		this.password = password;
		this.clientId = clientId;
		this.clientSecret = clientSecret;
		this.tenantId = tenantId;
		this.httpClient = HttpClients.createDefault();
	}

	@Override
	public @NotNull SessionCredentials authenticate() throws ListenerException {
		LOG.debug("Authenticating as {} on {}", username, loginUrl);
		var request = new HttpPost(loginUrl);
		request.setEntity(new UrlEncodedFormEntity(List.of(
				new BasicNameValuePair("grant_type", "password"),
				new BasicNameValuePair("username", username),
				new BasicNameValuePair("password", password),
				new BasicNameValuePair("client_id", clientId),
				new BasicNameValuePair("client_secret", clientSecret)
		), StandardCharsets.UTF_8));
		try {
			var credentials = httpClient.execute(request, response -> {
				var body = response.getEntity() != null ? EntityUtils.toString(response.getEntity()) : "";
				if (response.getCode() != HttpStatus.SC_OK) {
					throw ListenerException.of(ListenerErrorType.AUTH_ERROR,
							"Status:" + response.getCode() + "  Message:" + body);
				}
				return parseCredentials(body);
			});
			LOG.debug("Authenticated on {}", credentials.instanceUrl());
			return credentials;
		} catch (IOException e) {
			throw ListenerException.of(ListenerErrorType.AUTH_ERROR, "Login request to " + loginUrl + " failed", e);
		}
	}

	private SessionCredentials parseCredentials(String body) {
		JsonNode json;
		try {
			json = MAPPER.readTree(body);
		} catch (IOException e) {
			throw ListenerException.of(ListenerErrorType.AUTH_ERROR, "Login response is not valid JSON", e);
		}
		var accessToken = json.path("access_token").asText("");
		var instanceUrl = json.path("instance_url").asText("");
		if (accessToken.isEmpty() || instanceUrl.isEmpty()) {
			throw ListenerException.of(ListenerErrorType.AUTH_ERROR,
					"Login response has no access_token or instance_url");
		}
		return new SessionCredentials(accessToken, instanceUrl, tenantId);
	}

	@Override
	public void close() throws IOException {
		httpClient.close();
	}
}
