package com.jdbg.output;

/**
 * How a trace is laid out.
 *
 * @param showLocation print the call-site header above the trace
 * @param color        ANSI colors for source, values and markers
 * @param lineWidth    width that source and values are fitted into before they are broken
 * @param decorate     underline the block labels of {@code case} and {@code cond} traces
 */
public record RenderOptions(boolean showLocation, boolean color, int lineWidth, boolean decorate) {

    public static final int DEFAULT_LINE_WIDTH = 80;

    public RenderOptions {
        if (lineWidth <= 0) {
            throw new IllegalArgumentException("Line width must be positive, got " + lineWidth);
        }
    }

    public static RenderOptions defaults() {
        return new RenderOptions(true, false, DEFAULT_LINE_WIDTH, false);
    }

    public RenderOptions withColor(boolean enabled) {
        return new RenderOptions(showLocation, enabled, lineWidth, enabled);
    }

    public RenderOptions withShowLocation(boolean enabled) {
        return new RenderOptions(enabled, color, lineWidth, decorate);
    }

    public RenderOptions withLineWidth(int width) {
        return new RenderOptions(showLocation, color, width, decorate);
    }
}
