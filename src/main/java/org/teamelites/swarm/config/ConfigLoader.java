package org.teamelites.swarm.config;

import java.net.URISyntaxException;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the swarm configuration.
 * <p>
 * Layers, highest precedence first: Java system properties, environment variables, the
 * discovered {@value #CONFIG_FILE_NAME} file, and the {@code reference.conf} defaults on the
 * classpath. Substitutions are resolved once all layers are stacked, so an override of a value
 * referenced elsewhere in {@code reference.conf} reaches every reference.
 * <p>
 * The file is discovered in this order:
 * <ol>
 *   <li>an explicitly given file,</li>
 *   <li>the {@code -Dconfig.file} system property,</li>
 *   <li>{@code config/team-elites.conf} below the working directory,</li>
 *   <li>{@code config/team-elites.conf} below the installation directory (parent of the
 *       directory holding the application jar),</li>
 *   <li>none: classpath defaults only.</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /** Root path of all swarm settings. */
    public static final String ROOT = "team-elites";
    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "team-elites.conf";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages of the discovery cascade.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Handler that forwards messages to this class's SLF4J logger.
     */
    public static ConfigMessageHandler slf4jHandler() {
        return (level, message) -> {
            if (level == MessageLevel.WARN) {
                log.warn(message);
            } else {
                log.info(message);
            }
        };
    }

    /**
     * Resolves the configuration.
     *
     * @param explicitConfigFile file to use, or null for discovery.
     * @param handler            progress callback.
     * @return the resolved root config.
     * @throws IllegalArgumentException                 if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException      if a file cannot be parsed or resolved.
     */
    public static Config resolve(Path explicitConfigFile, ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            requireExists(explicitConfigFile, "Configuration file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file " + explicitConfigFile.toAbsolutePath());
            return load(explicitConfigFile);
        }

        String property = System.getProperty("config.file");
        if (property != null && !property.isBlank()) {
            Path file = Path.of(property).toAbsolutePath();
            requireExists(file, "Configuration file specified via -Dconfig.file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: " + file);
            return load(file);
        }

        Path inWorkingDir = Path.of(CONFIG_DIR, CONFIG_FILE_NAME);
        if (Files.isRegularFile(inWorkingDir)) {
            handler.log(MessageLevel.INFO, "Using configuration file " + inWorkingDir.toAbsolutePath());
            return load(inWorkingDir);
        }

        Optional<Path> inInstallation = installationConfigFile();
        if (inInstallation.isPresent()) {
            handler.log(MessageLevel.INFO, "Using configuration file from installation directory: "
                    + inInstallation.get());
            return load(inInstallation.get());
        }

        handler.log(MessageLevel.WARN, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                + " found, using classpath defaults");
        return load(null);
    }

    /**
     * Stacks the layers on top of an optional file.
     *
     * @param file the user file, or null.
     * @return the resolved root config.
     */
    static Config load(Path file) {
        Config userLayer = file == null ? ConfigFactory.empty() : ConfigFactory.parseFile(file.toFile());
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(userLayer)
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    private static void requireExists(Path file, String message) {
        if (!Files.exists(file)) {
            throw new IllegalArgumentException(message + file.toAbsolutePath());
        }
    }

    private static Optional<Path> installationConfigFile() {
        CodeSource source = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (source == null || source.getLocation() == null) {
            return Optional.empty();
        }
        Path location;
        try {
            location = Path.of(source.getLocation().toURI());
        } catch (URISyntaxException | IllegalArgumentException | FileSystemNotFoundException e) {
            log.debug("Cannot derive installation directory from {}", source.getLocation(), e);
            return Optional.empty();
        }
        // A jar sits in APP_HOME/lib; a classes directory is its own root.
        Path appHome = Files.isRegularFile(location) && location.getParent() != null
                ? location.getParent().getParent()
                : location;
        if (appHome == null) {
            return Optional.empty();
        }
        Path candidate = appHome.resolve(CONFIG_DIR).resolve(CONFIG_FILE_NAME);
        return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }
}
