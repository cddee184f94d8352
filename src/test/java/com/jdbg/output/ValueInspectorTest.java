package com.jdbg.output;

import com.jdbg.expr.Atom;
import org.eclipse.collections.impl.factory.Maps;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ValueInspectorTest {

    private final ValueInspector inspector = new ValueInspector(Palette.PLAIN, 80);

    @Test
    public void testScalars() {
        assertEquals("nil", inspector.inspect(null));
        assertEquals("true", inspector.inspect(true));
        assertEquals("42", inspector.inspect(42L));
        assertEquals("2.5", inspector.inspect(2.5));
        assertEquals("3.0", inspector.inspect(3.0));
        assertEquals("1.0e10", inspector.inspect(1.0e10));
        assertEquals(":ok", inspector.inspect(new Atom("ok")));
    }

    @Test
    public void testStringsAreQuotedAndEscaped() {
        assertEquals("\"plain\"", inspector.inspect("plain"));
        assertEquals("\"say \\\"hi\\\"\\n\"", inspector.inspect("say \"hi\"\n"));
    }

    @Test
    public void testControlCharactersNeverReachTheTerminalRaw() {
        assertEquals("\"\\e[31mred\"", inspector.inspect("\u001B[31mred"));
        assertEquals("\"a\\0b\"", inspector.inspect("a\u0000b"));
        assertEquals("\"\\a\\b\\f\\v\"", inspector.inspect("\u0007\b\f\u000B"));
        assertEquals("\"\\u0001\\u007F\"", inspector.inspect("\u0001\u007F"));
        assertEquals("\"caf\u00e9\"", inspector.inspect("caf\u00e9"));
    }

    @Test
    public void testIntegersBeyondLongRange() {
        assertEquals("9223372036854775808", inspector.inspect(new BigInteger("9223372036854775808")));
        assertEquals("[9223372036854775808]", inspector.inspect(List.of(new BigInteger("9223372036854775808"))));
    }

    @Test
    public void testCollections() {
        assertEquals("[1, \"a\", nil]", inspector.inspect(Arrays.asList(1L, "a", null)));
        assertEquals("[]", inspector.inspect(List.of()));
        assertEquals("%{a: 1, b: 2}", inspector.inspect(Maps.mutable.with(new Atom("b"), 2L, new Atom("a"), 1L)));
        assertEquals("%{\"x\" => [1]}", inspector.inspect(Maps.mutable.with("x", List.of(1L))));
    }

    @Test
    public void testLongCollectionsBreakOnePerLine() {
        ValueInspector narrow = new ValueInspector(Palette.PLAIN, 10);

        assertEquals("[\n  \"aaaa\",\n  \"bbbb\"\n]", narrow.inspect(List.of("aaaa", "bbbb")));
        assertEquals("[1, 2]", narrow.inspect(List.of(1L, 2L)));
    }

    @Test
    public void testColors() {
        ValueInspector colored = new ValueInspector(Palette.ANSI, 80);

        assertEquals("\u001B[33m7\u001B[0m", colored.inspect(7L));
        assertEquals("\u001B[32m\"s\"\u001B[0m", colored.inspect("s"));
        assertEquals("\u001B[36m:ok\u001B[0m", colored.inspect(new Atom("ok")));
        assertEquals("\u001B[35mnil\u001B[0m", colored.inspect(null));
    }
}
