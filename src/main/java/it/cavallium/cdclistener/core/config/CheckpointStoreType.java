package it.cavallium.cdclistener.core.config;

public enum CheckpointStoreType {
	FILE,
	MEMORY
}
