package it.cavallium.cdclistener.core.client;

import it.cavallium.cdclistener.core.common.ListenerException;
import it.cavallium.cdclistener.core.common.SessionCredentials;
import org.jetbrains.annotations.NotNull;

/**
 * Obtains a session for the Pub/Sub API.
 */
@FunctionalInterface
public interface Authenticator {

	/**
	 * @throws ListenerException with error type {@code AUTH_ERROR} if the login is rejected or unreachable
	 */
	@NotNull
	SessionCredentials authenticate() throws ListenerException;
}
