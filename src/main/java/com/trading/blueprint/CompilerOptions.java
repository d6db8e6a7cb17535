package com.trading.blueprint;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Settings of the compiler and its HTTP surface.
 *
 * <p>
 * {@link #load()} reads {@value #RESOURCE} from the classpath; keys missing
 * from the file keep their defaults.
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompilerOptions {
    public static final String RESOURCE = "blueprint-compiler.json";

    /** Class name used when the caller gives none. */
    private String strategyName = "BlueprintStrategy";
    private String baseImport = "from core.strategy.base import BaseStrategy";
    private String baseClass = "BaseStrategy";
    /** One indentation level of the generated source. */
    private String indent = "    ";
    private int serverPort = 7070;

    public static CompilerOptions defaults() {
        return new CompilerOptions();
    }

    public static CompilerOptions load() {
        return load(RESOURCE);
    }

    static CompilerOptions load(String resource) {
        try (InputStream in = CompilerOptions.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", resource);
                return defaults();
            }
            return new ObjectMapper().readValue(in, CompilerOptions.class);
        } catch (IOException e) {
            log.warn("Failed to read {}, using defaults", resource, e);
            return defaults();
        }
    }
}
