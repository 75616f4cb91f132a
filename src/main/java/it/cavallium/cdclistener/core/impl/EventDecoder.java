package it.cavallium.cdclistener.core.impl;

import it.cavallium.cdclistener.core.common.ListenerException;
import it.cavallium.cdclistener.core.common.cdc.DecodedEvent;
import org.apache.avro.Schema;
import org.jetbrains.annotations.NotNull;

public interface EventDecoder {

	/**
	 * Decode a payload written with the given schema.
	 *
	 * @throws ListenerException with error type {@code DECODE_ERROR} if the payload does not match the schema
	 */
	@NotNull
	DecodedEvent decode(@NotNull String schemaId, @NotNull Schema schema, byte @NotNull [] payload)
			throws ListenerException;
}
