package it.cavallium.cdclistener.core.common.cdc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Event decoded against its schema.
 * {@code fieldValues} never contains the change header itself.
 */
public record DecodedEvent(@NotNull String schemaId,
		@NotNull Map<String, Object> fieldValues,
		@Nullable ChangeHeader changeHeader) {

	public DecodedEvent {
		fieldValues = Collections.unmodifiableMap(new LinkedHashMap<>(fieldValues));
	}

	public Optional<ChangeHeader> header() {
		return Optional.ofNullable(changeHeader);
	}

	public boolean isChangeEvent() {
		return changeHeader != null;
	}

	/**
	 * @return the values of the top-level fields listed as changed, empty if this is not a change event
	 */
	public Map<String, Object> changedValues() {
		if (changeHeader == null) {
			return Map.of();
		}
		var result = new LinkedHashMap<String, Object>();
		fieldValues.forEach((name, value) -> {
			if (changeHeader.changedFields().contains(name)) {
				result.put(name, value);
			}
		});
		return result;
	}
}
