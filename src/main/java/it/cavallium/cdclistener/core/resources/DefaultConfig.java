package it.cavallium.cdclistener.core.resources;

import it.cavallium.cdclistener.core.common.ListenerException;
import it.cavallium.cdclistener.core.common.ListenerException.ListenerErrorType;
import java.io.InputStream;
import org.jetbrains.annotations.NotNull;

public class DefaultConfig {

	@NotNull
	public static InputStream getDefaultConfig() {
		var stream = DefaultConfig.class.getResourceAsStream("default.conf");
		if (stream == null) {
			throw ListenerException.of(ListenerErrorType.CONFIG_ERROR, "Missing default config resource: default.conf");
		}
		return stream;
	}
}
