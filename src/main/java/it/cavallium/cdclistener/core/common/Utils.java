package it.cavallium.cdclistener.core.common;

import java.net.URI;
import java.time.Duration;
import org.jetbrains.annotations.NotNull;

public class Utils {

	public static final int DEFAULT_PORT = 7443;

	public static HostAndPort parseHostAndPort(URI uri) {
		return new HostAndPort(uri.getHost(), parsePort(uri));
	}

	public static int parsePort(URI uri) {
		var port = uri.getPort();
		if (port == -1) {
			return DEFAULT_PORT;
		} else {
			return port;
		}
	}

	/**
	 * Sleep without throwing.
	 *
	 * @return false if the thread was interrupted, the interrupt flag is restored
	 */
	public static boolean sleep(@NotNull Duration duration) {
		if (duration.isZero() || duration.isNegative()) {
			return !Thread.currentThread().isInterrupted();
		}
		try {
			Thread.sleep(duration.toMillis());
			return true;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	public record HostAndPort(String host, int port) {}
}
