package it.cavallium.cdclistener.core.listener;

/**
 * Outcome of one batch: how many events were dispatched, how many failed, whether the replay token was saved.
 */
public record BatchResult(int events, int failedEvents, boolean checkpointed) {

	public boolean succeeded() {
		return failedEvents == 0;
	}
}
