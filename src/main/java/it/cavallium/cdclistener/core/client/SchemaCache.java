package it.cavallium.cdclistener.core.client;

import static java.util.Objects.requireNonNull;

import java.util.Optional;
import java.util.function.Function;
import org.apache.avro.Schema;
import org.cliffc.high_scale_lib.NonBlockingHashMap;
import org.jetbrains.annotations.NotNull;

/**
 * Schemas by id. A schema id always identifies the same schema, so entries are never replaced or evicted.
 * Reads are lock-free, population is serialized so that each id is fetched once.
 */
public class SchemaCache {

	private final NonBlockingHashMap<String, Schema> schemas = new NonBlockingHashMap<>();
	private final Object populateLock = new Object();

	@NotNull
	public Schema get(@NotNull String schemaId, @NotNull Function<String, Schema> loader) {
		var schema = schemas.get(schemaId);
		if (schema != null) {
			return schema;
		}
		synchronized (populateLock) {
			schema = schemas.get(schemaId);
			if (schema == null) {
				schema = requireNonNull(loader.apply(schemaId), "Loaded schema is null");
				schemas.put(schemaId, schema);
			}
			return schema;
		}
	}

	public Optional<Schema> getIfPresent(@NotNull String schemaId) {
		return Optional.ofNullable(schemas.get(schemaId));
	}

	public int size() {
		return schemas.size();
	}
}
