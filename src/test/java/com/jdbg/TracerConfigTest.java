package com.jdbg;

import com.jdbg.output.RenderOptions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class TracerConfigTest {

    @Test
    public void testDefaults() {
        TracerConfig config = TracerConfig.defaults();

        assertTrue(config.printLocation());
        assertEquals(80, config.width());
        assertFalse(config.color());
        assertEquals(Optional.empty(), config.outputDir());
    }

    @Test
    public void testFromOptions() {
        TracerConfig config = TracerConfig.fromOptions(Map.of(
            "print_location", false, "width", 40, "color", true, "output_dir", "/tmp/traces"));

        assertFalse(config.printLocation());
        assertEquals(40, config.width());
        assertTrue(config.color());
        assertEquals(Optional.of(Path.of("/tmp/traces")), config.outputDir());
    }

    @Test
    public void testFromOptionsRejectsUnknownKeysAndWrongTypes() {
        IllegalArgumentException unknown = assertThrows(IllegalArgumentException.class,
            () -> TracerConfig.fromOptions(Map.of("colour", true)));
        assertTrue(unknown.getMessage().startsWith("Unknown tracer option: colour"));

        assertThrows(IllegalArgumentException.class, () -> TracerConfig.fromOptions(Map.of("width", "wide")));
        assertThrows(IllegalArgumentException.class, () -> TracerConfig.fromOptions(Map.of("width", 0)));
        assertThrows(IllegalArgumentException.class, () -> TracerConfig.fromOptions(Map.of("output_dir", 3)));
    }

    @Test
    public void testRenderOptions() {
        RenderOptions options = new TracerConfig(false, 60, true, Optional.empty()).renderOptions();

        assertEquals(new RenderOptions(false, true, 60, true), options);
    }
}
