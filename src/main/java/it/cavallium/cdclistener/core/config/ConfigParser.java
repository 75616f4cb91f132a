package it.cavallium.cdclistener.core.config;

import it.cavallium.cdclistener.core.common.ListenerException;
import it.cavallium.cdclistener.core.common.ListenerException.ListenerErrorType;
import it.cavallium.cdclistener.core.resources.DefaultConfig;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.github.gestalt.config.builder.GestaltBuilder;
import org.github.gestalt.config.builder.SourceBuilder;
import org.github.gestalt.config.exceptions.GestaltException;
import org.github.gestalt.config.source.FileConfigSourceBuilder;
import org.github.gestalt.config.source.InputStreamConfigSourceBuilder;

public class ConfigParser {

	private final GestaltBuilder gsb;
	private final List<SourceBuilder<?, ?>> sourceBuilders = new ArrayList<>();

	public ConfigParser() {
		gsb = new GestaltBuilder();
		gsb
				.setTreatMissingArrayIndexAsError(false)
				.setTreatMissingDiscretionaryValuesAsErrors(false)
				.setTreatMissingValuesAsErrors(false)
				.addDefaultConfigLoaders()
				.addDefaultDecoders();
	}

	public static ListenerConfig parse(Path configPath) {
		var parser = new ConfigParser();
		if (configPath != null) {
			parser.addSource(configPath);
		}
		return parser.parse();
	}

	public static ListenerConfig parseDefault() {
		var parser = new ConfigParser();
		return parser.parse();
	}

	public void addSource(Path path) {
		if (path != null) {
			sourceBuilders.add(FileConfigSourceBuilder.builder().setPath(path));
		}
	}

	public ListenerConfig parse() {
		try {
			gsb.addSource(InputStreamConfigSourceBuilder
					.builder()
					.setConfig(DefaultConfig.getDefaultConfig())
					.setFormat("conf")
					.build());
			for (SourceBuilder<?, ?> sourceBuilder : sourceBuilders) {
				gsb.addSource(sourceBuilder.build());
			}
			var gestalt = gsb.build();
			gestalt.loadConfigs();

			return gestalt.getConfig("listener", ListenerConfig.class);
		} catch (GestaltException ex) {
			throw ListenerException.of(ListenerErrorType.CONFIG_ERROR, ex);
		}
	}
}
