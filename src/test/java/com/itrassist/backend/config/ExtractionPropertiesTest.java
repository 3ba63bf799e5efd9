package com.itrassist.backend.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ExtractionPropertiesTest {

    private final ExtractionProperties properties = new ExtractionProperties();

    @Test
    void isAllowedMimeType_ignoresParametersAndCase() {
        assertTrue(properties.isAllowedMimeType("text/html; charset=UTF-8"));
        assertTrue(properties.isAllowedMimeType("IMAGE/PNG"));
        assertFalse(properties.isAllowedMimeType("application/zip"));
        assertFalse(properties.isAllowedMimeType(null));
    }

    @Test
    void baseMimeType_stripsParameters() {
        assertEquals("text/plain", ExtractionProperties.baseMimeType(" Text/Plain ;charset=us-ascii"));
        assertEquals("", ExtractionProperties.baseMimeType(null));
    }
}
