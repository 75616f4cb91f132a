package it.cavallium.cdclistener.core.listener;

public enum ListenerState {
	NEW,
	SELECT_MODE,
	SUBSCRIBE,
	RECONNECT,
	PROCESS_BATCH,
	CHECKPOINT,
	STOPPED
}
