package nl.bytesoflife.deltabom.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link MatcherConfig} from a YAML file. A missing, unreadable or invalid file
 * yields {@link MatcherConfig#defaults()}.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    public static MatcherConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Matcher configuration not found: {}. Using defaults.", configPath);
            return MatcherConfig.defaults();
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Matcher configuration is not readable: {}. Using defaults.", configPath);
            return MatcherConfig.defaults();
        }

        try {
            log.debug("Loading matcher configuration from: {}", configPath);
            MatcherConfig config = YAML_MAPPER.readValue(configPath.toFile(), MatcherConfig.class);
            if (config == null) {
                log.warn("Matcher configuration is empty: {}. Using defaults.", configPath);
                return MatcherConfig.defaults();
            }
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse matcher configuration: {}. Using defaults. Error: {}",
                    configPath, e.getMessage());
            return MatcherConfig.defaults();
        }
    }
}
