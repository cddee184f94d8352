package com.jdbg.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * Writes rendered traces to the primary stream and, when an output directory is configured,
 * appends a plain-text record of each traced value to {@value #OUTPUT_FILE} inside it.
 */
public class OutputSink {
    private static final Logger LOG = LoggerFactory.getLogger(OutputSink.class);

    public static final String OUTPUT_FILE = "dbg_output";
    static final String SEPARATOR = "–".repeat(25);

    // Appends from every sink in the JVM go through this lock so records never interleave
    private static final Object APPEND_LOCK = new Object();

    private final PrintStream out;
    private final Path outputDir;
    private final ValueInspector plainValues = new ValueInspector(Palette.PLAIN, RenderOptions.DEFAULT_LINE_WIDTH);

    public OutputSink(PrintStream out, Optional<Path> outputDir) {
        this.out = out;
        this.outputDir = outputDir.orElse(null);
    }

    /**
     * Emits one trace and hands back its value unchanged.
     *
     * @throws UncheckedIOException if the record cannot be appended to the output file; the
     *                              rendered text has already been written to the primary stream
     */
    public Object emit(String rendered, Object finalValue, String location) {
        out.print(rendered);
        out.flush();

        if (outputDir != null) {
            append(record(location, finalValue));
        }
        return finalValue;
    }

    private String record(String location, Object value) {
        String text = value instanceof String s ? s : plainValues.inspect(value);
        return String.join("\n", SEPARATOR, location, text) + "\n";
    }

    private void append(String record) {
        Path file = outputDir.resolve(OUTPUT_FILE);
        synchronized (APPEND_LOCK) {
            try {
                Files.createDirectories(outputDir);
                Files.writeString(file, record, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append trace to " + file, e);
            }
        }
        LOG.debug("Appended trace record to {}", file);
    }
}
