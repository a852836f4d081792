package com.example.excelcompare.web;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContextPathCustomizerTest {

    @Test
    void prefix_gets_one_leading_slash() {
        assertEquals("/excel-compare", ContextPathCustomizer.normalizePrefix("excel-compare"));
        assertEquals("/excel-compare", ContextPathCustomizer.normalizePrefix("/excel-compare/"));
        assertEquals("/tools/diff", ContextPathCustomizer.normalizePrefix(" //tools/diff// "));
    }

    @Test
    void blank_prefix_serves_from_root() {
        assertEquals("", ContextPathCustomizer.normalizePrefix(null));
        assertEquals("", ContextPathCustomizer.normalizePrefix(""));
        assertEquals("", ContextPathCustomizer.normalizePrefix("/"));
        assertEquals("", new ContextPathCustomizer("  ").contextPath());
    }
}
