package com.jdbg;

import com.jdbg.output.RenderOptions;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Sets;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Settings handed over by whatever starts the tracer. Immutable once built.
 *
 * @param printLocation print the call-site header above every trace
 * @param width         line width for source and values
 * @param color         ANSI-colorize the output
 * @param outputDir     directory that receives a plain-text copy of every traced value
 */
public record TracerConfig(boolean printLocation, int width, boolean color, Optional<Path> outputDir) {

    private static final ImmutableSet<String> KNOWN_OPTIONS =
        Sets.immutable.with("print_location", "width", "color", "output_dir");

    public TracerConfig {
        if (width <= 0) {
            throw new IllegalArgumentException("Width must be positive, got " + width);
        }
        if (outputDir == null) {
            outputDir = Optional.empty();
        }
    }

    public static TracerConfig defaults() {
        return new TracerConfig(true, RenderOptions.DEFAULT_LINE_WIDTH, false, Optional.empty());
    }

    /**
     * Builds a config from keyword options as an orchestration layer passes them.
     *
     * @throws IllegalArgumentException for an unknown key or a value of the wrong type
     */
    public static TracerConfig fromOptions(Map<String, ?> options) {
        for (String key : options.keySet()) {
            if (!KNOWN_OPTIONS.contains(key)) {
                throw new IllegalArgumentException("Unknown tracer option: " + key
                    + " (expected one of " + KNOWN_OPTIONS.toSortedList().makeString(", ") + ")");
            }
        }
        TracerConfig defaults = defaults();
        boolean printLocation = option(options, "print_location", Boolean.class, defaults.printLocation());
        int width = option(options, "width", Number.class, defaults.width()).intValue();
        boolean color = option(options, "color", Boolean.class, defaults.color());
        Object dir = options.get("output_dir");
        Optional<Path> outputDir;
        if (dir == null) {
            outputDir = Optional.empty();
        } else if (dir instanceof Path path) {
            outputDir = Optional.of(path);
        } else if (dir instanceof String s) {
            outputDir = Optional.of(Path.of(s));
        } else {
            throw new IllegalArgumentException("Option output_dir must be a path, got " + dir);
        }
        return new TracerConfig(printLocation, width, color, outputDir);
    }

    private static <T> T option(Map<String, ?> options, String key, Class<T> type, T fallback) {
        Object value = options.get(key);
        if (value == null) {
            return fallback;
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Option " + key + " must be a " + type.getSimpleName()
                + ", got " + value);
        }
        return type.cast(value);
    }

    public TracerConfig withOutputDir(Path dir) {
        return new TracerConfig(printLocation, width, color, Optional.ofNullable(dir));
    }

    public RenderOptions renderOptions() {
        return RenderOptions.defaults()
            .withShowLocation(printLocation)
            .withLineWidth(width)
            .withColor(color);
    }
}
