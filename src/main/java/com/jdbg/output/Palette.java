package com.jdbg.output;

import picocli.CommandLine.Help.Ansi.IStyle;
import picocli.CommandLine.Help.Ansi.Style;

/**
 * ANSI styling for trace output. {@link #PLAIN} leaves text untouched.
 */
public final class Palette {
    public static final Palette PLAIN = new Palette(false);
    public static final Palette ANSI = new Palette(true);

    private final boolean enabled;

    private Palette(boolean enabled) {
        this.enabled = enabled;
    }

    public static Palette of(boolean color) {
        return color ? ANSI : PLAIN;
    }

    public boolean enabled() {
        return enabled;
    }

    String number(String text) {
        return style(text, Style.fg_yellow);
    }

    String string(String text) {
        return style(text, Style.fg_green);
    }

    String atom(String text) {
        return style(text, Style.fg_cyan);
    }

    String bool(String text) {
        return style(text, Style.fg_magenta);
    }

    String faint(String text) {
        return style(text, Style.faint);
    }

    String header(String text) {
        return style(text, Style.fg_cyan, Style.italic);
    }

    private String style(String text, IStyle... styles) {
        if (!enabled) {
            return text;
        }
        return Style.on(styles) + text + Style.reset.on();
    }

    /** Underlining is decided by the caller, independently of whether colors are on. */
    static String underline(String text) {
        return Style.underline.on() + text + Style.reset.on();
    }
}
