package com.jdbg.trace;

import com.jdbg.expr.Fragment;

/**
 * One recorded evaluation: a piece of source and the value it produced.
 */
public record Step(Fragment source, Object value) {}
