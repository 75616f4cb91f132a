package it.cavallium.cdclistener.core.common;

import org.jetbrains.annotations.NotNull;

public interface HeartbeatStore {

	void put(@NotNull Heartbeat heartbeat) throws ListenerException;
}
