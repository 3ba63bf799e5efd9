package com.itrassist.backend.services.documents.corrections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

import com.itrassist.backend.entities.FieldNames;

class FieldCorrectionTest {

    @Test
    void of_parsesFormattedAmounts() {
        FieldCorrection c = FieldCorrection.of(" Salary ", "₹ 12,00,000");

        assertEquals("Salary", c.name());
        assertEquals(0, new BigDecimal("1200000").compareTo(c.value().asNumber().orElseThrow()));
    }

    @Test
    void of_keepsJsonNumbers() {
        assertEquals(0, new BigDecimal("90000").compareTo(FieldCorrection.of(FieldNames.TDS, 90000).value().asNumber().orElseThrow()));
    }

    @Test
    void of_textFieldsStayText() {
        FieldCorrection c = FieldCorrection.of(FieldNames.EMPLOYER, 12345);

        assertFalse(c.value().isNumeric());
        assertEquals("12345", c.value().asText());
    }

    @Test
    void of_nonNumericInputStaysText() {
        FieldCorrection c = FieldCorrection.of(FieldNames.SALARY, "abc");

        assertFalse(c.value().isNumeric());
        assertTrue(FieldCorrection.of(FieldNames.SALARY, null).value().isBlank());
    }
}
