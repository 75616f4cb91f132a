package it.cavallium.cdclistener.core.config;

import org.github.gestalt.config.exceptions.GestaltException;

public interface HeartbeatConfig {

	boolean enabled() throws GestaltException;

	String group() throws GestaltException;

	/**
	 * Empty to use the application name.
	 */
	String name() throws GestaltException;
}
