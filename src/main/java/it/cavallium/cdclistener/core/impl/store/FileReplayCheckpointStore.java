package it.cavallium.cdclistener.core.impl.store;

import it.cavallium.cdclistener.core.common.ListenerException;
import it.cavallium.cdclistener.core.common.ListenerException.ListenerErrorType;
import it.cavallium.cdclistener.core.common.ReplayCheckpointStore;
import it.cavallium.cdclistener.core.common.cdc.ReplayToken;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores one Base64 token file per topic. Files are replaced atomically, so a crash leaves either the previous or
 * the new token.
 */
public class FileReplayCheckpointStore implements ReplayCheckpointStore {

	private static final Logger LOG = LoggerFactory.getLogger(FileReplayCheckpointStore.class);
	private static final String EXTENSION = ".token";

	private final Path directory;

	public FileReplayCheckpointStore(@NotNull Path directory) {
		this.directory = directory;
		try {
			Files.createDirectories(directory);
		} catch (IOException e) {
			throw ListenerException.of(ListenerErrorType.CONFIG_ERROR,
					"Can't create the checkpoint directory " + directory, e);
		}
	}

	@Override
	public Optional<ReplayToken> get(@NotNull String topic) {
		var file = fileOf(topic);
		if (Files.notExists(file)) {
			return Optional.empty();
		}
		try {
			var text = Files.readString(file, StandardCharsets.US_ASCII).trim();
			if (text.isEmpty()) {
				return Optional.empty();
			}
			return Optional.of(ReplayToken.fromBase64(text));
		} catch (IOException | IllegalArgumentException e) {
			throw ListenerException.of(ListenerErrorType.CHECKPOINT_READ_ERROR,
					"Can't read the checkpoint of topic " + topic + " from " + file, e);
		}
	}

	@Override
	public void put(@NotNull String topic, @NotNull ReplayToken token) {
		var file = fileOf(topic);
		try {
			var tempFile = Files.createTempFile(directory, ".checkpoint-", ".tmp");
			try {
				Files.writeString(tempFile, token.toBase64(), StandardCharsets.US_ASCII);
				Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			} finally {
				Files.deleteIfExists(tempFile);
			}
			LOG.debug("Saved checkpoint {} of topic {} to {}", token, topic, file);
		} catch (IOException e) {
			throw ListenerException.of(ListenerErrorType.CHECKPOINT_WRITE_ERROR,
					"Can't write the checkpoint of topic " + topic + " to " + file, e);
		}
	}

	private Path fileOf(String topic) {
		var name = topic.replaceAll("[^A-Za-z0-9._-]", "_");
		return directory.resolve(name + EXTENSION);
	}

	@Override
	public String toString() {
		return "FileReplayCheckpointStore[" + directory + "]";
	}
}
