package it.cavallium.cdclistener.core.listener;

import it.cavallium.cdclistener.core.common.cdc.ReplayToken;
import it.cavallium.cdclistener.core.common.cdc.SubscriptionMode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Start position resolved when a listener starts. The token is set only in {@link SubscriptionMode#CUSTOM} mode.
 */
public record ReplayPosition(@NotNull SubscriptionMode mode, @Nullable ReplayToken token) {
}
