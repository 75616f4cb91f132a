package it.cavallium.cdclistener.core.common.cdc;

import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Change metadata carried by change events.
 * The change type is reported verbatim, field sets preserve the schema field order.
 */
public record ChangeHeader(@NotNull String changeType,
		@Nullable String entityName,
		@NotNull List<String> recordIds,
		@Nullable Long commitTimestamp,
		@NotNull Set<String> changedFields,
		@NotNull Set<String> nulledFields,
		@NotNull Set<String> diffFields) {
}
