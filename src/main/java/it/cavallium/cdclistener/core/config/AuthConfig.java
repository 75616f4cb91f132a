package it.cavallium.cdclistener.core.config;

import org.github.gestalt.config.exceptions.GestaltException;

public interface AuthConfig {

	/**
	 * OAuth token endpoint, for example {@code https://login.salesforce.com/services/oauth2/token}
	 */
	String loginUrl() throws GestaltException;

	String username() throws GestaltException;

	String password() throws GestaltException;

	String clientId() throws GestaltException;

	String clientSecret() throws GestaltException;

	/**
	 * Organization id sent as {@code tenantid} metadata. Empty to omit it.
	 */
	String tenantId() throws GestaltException;
}
