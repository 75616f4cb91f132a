package it.cavallium.cdclistener.core.common;

import it.cavallium.cdclistener.core.common.cdc.DecodedEvent;
import org.jetbrains.annotations.NotNull;

/**
 * Business logic invoked for every decoded event.
 * <p>
 * Delivery is at-least-once: an event of a batch that was not checkpointed is delivered again after a reconnect
 * or a restart, so implementations must be idempotent.
 */
@FunctionalInterface
public interface EventHandler {

	/**
	 * @return true if the event was handled. False, or an exception, withholds the checkpoint of the whole batch
	 */
	boolean handle(@NotNull DecodedEvent event);
}
