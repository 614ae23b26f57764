package org.loxlang.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URL;
import java.security.CodeSource;
import java.security.ProtectionDomain;

/**
 * Loads the HOCON configuration for the {@code lox} command.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dlox.runtime.max-call-depth=500})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file, if one is found (see {@link #resolve(File, ConfigMessageHandler)})</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "lox.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a message emitted while locating the configuration file.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is located. The caller decides
     * whether they are logged or printed.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        /**
         * @param level   the severity of the message.
         * @param message the human-readable description.
         */
        void log(MessageLevel level, String message);
    }

    /**
     * Locates the user configuration file, first match wins:
     * <ol>
     *   <li>the file given with {@code --config}</li>
     *   <li>the file given with {@code -Dconfig.file}</li>
     *   <li>{@code config/lox.conf} in the working directory</li>
     *   <li>{@code config/lox.conf} in the installation directory, inferred from the JAR location</li>
     *   <li>none; only {@code reference.conf} is used</li>
     * </ol>
     *
     * @param explicitConfigFile the {@code --config} file, or {@code null}.
     * @param handler            receives one message naming the chosen source.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO, "Using configuration file from --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file from -Dconfig.file not found: " + systemConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: " + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        final File workingDirFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + workingDirFile.getAbsolutePath());
            return loadFromFile(workingDirFile);
        }

        final File installationFile = detectInstallationConfigFile();
        if (installationFile != null) {
            handler.log(MessageLevel.INFO, "Using installation configuration file " + installationFile.getAbsolutePath());
            return loadFromFile(installationFile);
        }

        // Running without a user file is the common case for scripts, hence not a warning.
        handler.log(MessageLevel.INFO, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME + " found, using built-in defaults");
        return loadDefaults();
    }

    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Finds {@code APP_HOME/config/lox.conf} for an installation laid out as
     * {@code APP_HOME/lib/lox.jar}.
     *
     * @return the file, or {@code null} if the layout does not match or the file is absent.
     */
    private static File detectInstallationConfigFile() {
        final ProtectionDomain protectionDomain = ConfigLoader.class.getProtectionDomain();
        final CodeSource codeSource = protectionDomain == null ? null : protectionDomain.getCodeSource();
        if (codeSource == null) {
            return null;
        }
        final URL location = codeSource.getLocation();
        final File jarOrClasses;
        try {
            jarOrClasses = new File(location.toURI());
        } catch (java.net.URISyntaxException | IllegalArgumentException e) {
            return null;
        }

        // Only a JAR under lib/ identifies an installation; a classes directory never does.
        if (!jarOrClasses.isFile() || jarOrClasses.getParentFile() == null) {
            return null;
        }
        final File appHome = jarOrClasses.getParentFile().getParentFile();
        if (appHome == null) {
            return null;
        }

        final File configFile = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return configFile.exists() ? configFile : null;
    }
}
