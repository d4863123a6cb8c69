package ua.beengoo.rolink.bot.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads {@code config.yml}: bundled defaults first, the user's file merged on top so that
 * keys missing from it keep their default value.
 */
@Slf4j
public final class ConfigLoader {
    public static final String DEFAULTS_RESOURCE = "config.yml";

    private ConfigLoader() {
        // utility class
    }

    public static ObjectMapper yamlMapper() {
        ObjectMapper om = new ObjectMapper(new YAMLFactory());
        om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        om.setDefaultMergeable(true);
        return om;
    }

    /** Reads the config, writing the bundled defaults to {@code file} first if it does not exist yet. */
    public static RoLinkConfig load(Path file) {
        if (!Files.exists(file)) {
            saveDefaults(file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    public static RoLinkConfig load(InputStream userConfig) throws IOException {
        ObjectMapper om = yamlMapper();
        RoLinkConfig cfg = defaults(om);
        // an empty user file parses to nothing and leaves the defaults untouched
        byte[] raw = userConfig.readAllBytes();
        if (raw.length > 0 && !new String(raw, StandardCharsets.UTF_8).isBlank()) {
            om.readerForUpdating(cfg).readValue(raw);
        }
        return cfg;
    }

    private static RoLinkConfig defaults(ObjectMapper om) throws IOException {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                log.warn("Bundled {} not found, using built-in defaults", DEFAULTS_RESOURCE);
                return new RoLinkConfig();
            }
            return om.readValue(in, RoLinkConfig.class);
        }
    }

    private static void saveDefaults(Path file) {
        try (InputStream in = Objects.requireNonNull(
                ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE),
                "Bundled config.yml not found")) {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.copy(in, file);
            log.info("Wrote default configuration to {}", file.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write default config to " + file, e);
        }
    }
}
