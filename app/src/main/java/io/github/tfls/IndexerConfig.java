package io.github.tfls;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Settings for one workspace. Defaults are overridden by {@code <root>/.tfls/config.json}, which is in turn overridden
 * by the system properties {@code tfls.workers}, {@code tfls.watch} and {@code tfls.ignoredDirs} (comma separated).
 * A malformed file or property is logged and ignored.
 */
public record IndexerConfig(int workers, Set<String> ignoredDirectories, boolean watchFiles) {
    private static final Logger logger = LogManager.getLogger(IndexerConfig.class);

    public static final String CONFIG_DIR = ".tfls";
    public static final String CONFIG_FILE = "config.json";

    public static final Set<String> DEFAULT_IGNORED_DIRECTORIES = Set.of(
            ".git",
            ".idea",
            ".vscode",
            ".terraform",
            ".terragrunt-cache",
            "terraform.tfstate.d",
            "node_modules",
            CONFIG_DIR);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public IndexerConfig {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got " + workers);
        }
        ignoredDirectories = Set.copyOf(ignoredDirectories);
    }

    public static IndexerConfig defaults() {
        int workers = Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors()));
        return new IndexerConfig(workers, DEFAULT_IGNORED_DIRECTORIES, true);
    }

    public static IndexerConfig load(Path root) {
        return load(root, System.getProperties());
    }

    @VisibleForTesting
    static IndexerConfig load(Path root, Properties properties) {
        var config = defaults();
        var file = root.resolve(CONFIG_DIR).resolve(CONFIG_FILE);
        if (Files.isRegularFile(file)) {
            config = config.merge(readFile(file));
        }
        return config.withProperties(properties);
    }

    public IndexerConfig withWorkers(int newWorkers) {
        return new IndexerConfig(newWorkers, ignoredDirectories, watchFiles);
    }

    public IndexerConfig withWatchFiles(boolean newWatchFiles) {
        return new IndexerConfig(workers, ignoredDirectories, newWatchFiles);
    }

    public IndexerConfig withIgnoredDirectories(Set<String> newIgnoredDirectories) {
        return new IndexerConfig(workers, newIgnoredDirectories, watchFiles);
    }

    private static @Nullable ConfigFile readFile(Path file) {
        try {
            var parsed = MAPPER.readValue(file.toFile(), ConfigFile.class);
            logger.debug("Loaded configuration from {}", file);
            return parsed;
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring malformed configuration {}: {}", file, e.getOriginalMessage());
            return null;
        } catch (IOException e) {
            logger.warn("Unable to read configuration {}: {}", file, e.toString());
            return null;
        }
    }

    private IndexerConfig merge(@Nullable ConfigFile file) {
        if (file == null) {
            return this;
        }
        var result = this;
        if (file.workers != null) {
            if (file.workers < 1) {
                logger.warn("Ignoring workers={} from configuration file; must be >= 1", file.workers);
            } else {
                result = result.withWorkers(file.workers);
            }
        }
        if (file.ignoredDirectories != null) {
            result = result.withIgnoredDirectories(Set.copyOf(file.ignoredDirectories));
        }
        if (file.watchFiles != null) {
            result = result.withWatchFiles(file.watchFiles);
        }
        return result;
    }

    private IndexerConfig withProperties(Properties properties) {
        var result = this;
        var workersProp = properties.getProperty("tfls.workers");
        if (workersProp != null) {
            try {
                int parsed = Integer.parseInt(workersProp.trim());
                if (parsed < 1) {
                    logger.warn("Ignoring tfls.workers={}; must be >= 1", workersProp);
                } else {
                    result = result.withWorkers(parsed);
                }
            } catch (NumberFormatException e) {
                logger.warn("Invalid tfls.workers value '{}'; ignoring override", workersProp);
            }
        }
        var watchProp = properties.getProperty("tfls.watch");
        if (watchProp != null) {
            result = result.withWatchFiles(Boolean.parseBoolean(watchProp.trim()));
        }
        var ignoredProp = properties.getProperty("tfls.ignoredDirs");
        if (ignoredProp != null) {
            var dirs = new LinkedHashSet<>(
                    Splitter.on(',').trimResults().omitEmptyStrings().splitToList(ignoredProp));
            result = result.withIgnoredDirectories(dirs);
        }
        return result;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class ConfigFile {
        @JsonProperty("workers")
        @Nullable
        Integer workers;

        @JsonProperty("ignoredDirectories")
        @Nullable
        List<String> ignoredDirectories;

        @JsonProperty("watchFiles")
        @Nullable
        Boolean watchFiles;
    }
}
