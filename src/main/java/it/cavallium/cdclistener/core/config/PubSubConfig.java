package it.cavallium.cdclistener.core.config;

import java.time.Duration;
import org.github.gestalt.config.exceptions.GestaltException;

public interface PubSubConfig {

	String host() throws GestaltException;

	int port() throws GestaltException;

	boolean plaintext() throws GestaltException;

	Duration requestTimeout() throws GestaltException;
}
