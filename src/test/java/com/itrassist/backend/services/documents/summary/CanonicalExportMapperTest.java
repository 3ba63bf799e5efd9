package com.itrassist.backend.services.documents.summary;

import static com.itrassist.backend.support.TaxDocumentFixtures.amount;
import static com.itrassist.backend.support.TaxDocumentFixtures.extraction;
import static com.itrassist.backend.support.TaxDocumentFixtures.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.math.BigDecimal;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.itrassist.backend.config.TaxRulesProperties;
import com.itrassist.backend.entities.FieldNames;
import com.itrassist.backend.enums.DocumentType;

class CanonicalExportMapperTest {

    private final CanonicalExportMapper mapper = new CanonicalExportMapper(TaxRulesProperties.defaults());

    @Test
    void export_form16() {
        Map<String, Object> out = mapper.export(extraction(DocumentType.FORM_16,
                text(FieldNames.PAN, "ABCDE1234F"),
                text(FieldNames.EMPLOYER, "Acme"),
                amount(FieldNames.SALARY, 1_200_000),
                amount(FieldNames.DEDUCTIONS, 150_000),
                amount(FieldNames.TDS, 90_000),
                amount(FieldNames.TAXABLE_INCOME, 1_050_000)));

        assertEquals("Form 16", out.get("document_type"));
        assertEquals("ABCDE1234F", out.get("PAN"));
        assertEquals("Acme", out.get("employer_name"));
        assertEquals(BigDecimal.valueOf(1_200_000), out.get("gross_salary"));
        assertEquals(Map.of("section_80C", BigDecimal.valueOf(150_000)), out.get("deductions"));
        assertEquals(BigDecimal.valueOf(90_000), out.get("tds_deducted"));
        assertEquals(new BigDecimal("105000"), out.get("tax_payable"));
    }

    @Test
    void export_form16WithoutTaxableIncomeOmitsTaxPayable() {
        Map<String, Object> out = mapper.export(extraction(DocumentType.FORM_16, text(FieldNames.PAN, "ABCDE1234F")));

        assertFalse(out.containsKey("tax_payable"));
        assertFalse(out.containsKey("gross_salary"));
    }

    @Test
    void export_annualStatementMirrorsTds() {
        Map<String, Object> out = mapper.export(extraction(DocumentType.ANNUAL_TAX_STATEMENT,
                text(FieldNames.PAN, "ABCDE1234F"),
                amount(FieldNames.TDS, 75_000)));

        assertEquals("ABCDE1234F", out.get("pan"));
        assertEquals(BigDecimal.valueOf(75_000), out.get("tax_deducted_at_source"));
        assertEquals(BigDecimal.valueOf(75_000), out.get("total_tax_paid"));
    }

    @Test
    void export_salarySlipNetSalary() {
        Map<String, Object> out = mapper.export(extraction(DocumentType.SALARY_SLIP,
                amount(FieldNames.SALARY, 100_000),
                amount(FieldNames.DEDUCTIONS, 12_000)));

        assertEquals(BigDecimal.valueOf(88_000), out.get("net_salary"));
    }

    @Test
    void export_investmentProof() {
        Map<String, Object> out = mapper.export(extraction(DocumentType.INVESTMENT_PROOF, amount(FieldNames.ELIGIBLE_80C, 46_000)));

        assertEquals("80C", out.get("section"));
        assertEquals(BigDecimal.valueOf(46_000), out.get("amount_invested"));
    }

    @Test
    void export_untypedDocumentOnlyCarriesLabel() {
        Map<String, Object> out = mapper.export(extraction(null, amount(FieldNames.SALARY, 1)));

        assertEquals(Map.of("document_type", ""), out);
    }
}
