package com.gridcore.calc.io;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.extern.log4j.Log4j2;

/**
 * Reads {@link EngineConfig} from JSON.
 */
@Log4j2
public final class EngineConfigLoader {
    public static final String DEFAULT_RESOURCE = "gridcalc.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EngineConfigLoader() {
    }

    /** The classpath resource {@value #DEFAULT_RESOURCE}, or defaults when it is absent. */
    public static EngineConfig load() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public static EngineConfig loadResource(String resource) {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null)
            cl = EngineConfigLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("No {} on the classpath, using defaults", resource);
                return EngineConfig.defaults();
            }
            EngineConfig config = MAPPER.readValue(in, EngineConfig.class).validate();
            log.info("Loaded engine config from classpath:{}: {}", resource, config);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read classpath:" + resource, e);
        }
    }

    public static EngineConfig load(Path path) throws IOException {
        EngineConfig config = parse(Files.readString(path));
        log.info("Loaded engine config from {}: {}", path, config);
        return config;
    }

    public static EngineConfig parse(String json) throws IOException {
        return MAPPER.readValue(json, EngineConfig.class).validate();
    }
}
