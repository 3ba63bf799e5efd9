package com.itrassist.backend.services.documents.corrections;

import static com.itrassist.backend.support.TaxDocumentFixtures.amount;
import static com.itrassist.backend.support.TaxDocumentFixtures.extraction;
import static com.itrassist.backend.support.TaxDocumentFixtures.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.itrassist.backend.entities.FieldNames;
import com.itrassist.backend.enums.DocumentType;
import com.itrassist.backend.services.documents.corrections.ManualFieldCatalog.FieldKind;
import com.itrassist.backend.services.documents.corrections.ManualFieldCatalog.ManualFieldDefinition;

class ManualFieldCatalogTest {

    private final ManualFieldCatalog catalog = new ManualFieldCatalog();

    private static List<String> names(List<ManualFieldDefinition> defs) {
        return defs.stream().map(ManualFieldDefinition::name).collect(Collectors.toList());
    }

    @Test
    void definitionsFor_form16() {
        List<ManualFieldDefinition> defs = catalog.definitionsFor(DocumentType.FORM_16, Set.of());

        assertEquals(List.of(FieldNames.PAN, FieldNames.EMPLOYER, FieldNames.SALARY, FieldNames.TDS,
                FieldNames.DEDUCTIONS, FieldNames.TAXABLE_INCOME), names(defs));
        assertEquals(FieldKind.TEXT, defs.get(0).kind());
        assertTrue(defs.get(2).required());
    }

    @Test
    void definitionsFor_annualStatementSkipsKnownPan() {
        assertTrue(names(catalog.definitionsFor(DocumentType.ANNUAL_TAX_STATEMENT, Set.of())).contains(FieldNames.PAN));
        assertEquals(List.of(FieldNames.TDS, FieldNames.TAXABLE_INCOME),
                names(catalog.definitionsFor(DocumentType.ANNUAL_TAX_STATEMENT, Set.of("pan"))));
    }

    @Test
    void definitionsFor_unknownTypeIsEmpty() {
        assertTrue(catalog.definitionsFor(null, Set.of()).isEmpty());
    }

    @Test
    void missingRequiredFields_listsAbsentAndBlank() {
        List<String> missing = catalog.missingRequiredFields(extraction(DocumentType.FORM_16,
                text(FieldNames.EMPLOYER, "  "),
                amount(FieldNames.SALARY, 1_000_000)), Set.of());

        assertEquals(List.of(FieldNames.PAN, FieldNames.EMPLOYER), missing);
    }
}
