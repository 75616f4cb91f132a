package it.cavallium.cdclistener.core.config;

import java.nio.file.Path;
import org.github.gestalt.config.exceptions.GestaltException;

public interface CheckpointConfig {

	CheckpointStoreType type() throws GestaltException;

	Path directory() throws GestaltException;
}
