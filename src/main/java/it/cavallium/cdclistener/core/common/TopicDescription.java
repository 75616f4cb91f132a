package it.cavallium.cdclistener.core.common;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public record TopicDescription(@NotNull String topicName, @Nullable String schemaId, boolean canSubscribe) {
}
