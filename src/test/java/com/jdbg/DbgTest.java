package com.jdbg;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DbgTest {

    @Test
    public void testConfigurationIsFixedOnceTracerIsInUse() {
        Tracer tracer = Dbg.tracer();

        assertSame(tracer, Dbg.tracer());
        assertThrows(IllegalStateException.class, () -> Dbg.configure(TracerConfig.defaults()));
        assertSame(tracer, Dbg.tracer());
    }
}
