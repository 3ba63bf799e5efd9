package com.itrassist.backend.services.documents.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.itrassist.backend.config.ExtractionProperties;
import com.itrassist.backend.entities.ExtractedField;
import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.entities.FieldNames;
import com.itrassist.backend.enums.DocumentType;
import com.itrassist.backend.enums.ExtractionQuality;
import com.itrassist.backend.enums.FieldSource;

class HeuristicFieldExtractorTest {

    static final String FORM_16_TEXT = String.join("\n",
            "FORM 16",
            "Employer: Acme Technologies Pvt Ltd",
            "PAN of Employee: ABCDE1234F",
            "Gross Salary: 12,00,000",
            "Deductions under Chapter VI-A: 1,50,000",
            "Total Taxable Income: 10,50,000",
            "Tax Deducted at Source (TDS): 90,000");

    private final HeuristicFieldExtractor extractor =
            new HeuristicFieldExtractor(new ExtractionQualityEvaluator(new ExtractionProperties()));

    @Test
    void extract_form16_findsIdentityAndAmounts() {
        ExtractionResult result = extractor.extract(FORM_16_TEXT, DocumentType.FORM_16, "Form 16");

        List<String> names = result.getFields().stream().map(ExtractedField::name).collect(Collectors.toList());
        assertEquals(List.of(FieldNames.PAN, FieldNames.EMPLOYER, FieldNames.SALARY,
                FieldNames.TAXABLE_INCOME, FieldNames.TDS, FieldNames.DEDUCTIONS), names);

        assertEquals("ABCDE1234F", result.field(FieldNames.PAN).orElseThrow().value().asText());
        assertEquals(FieldSource.RULE_REGEX, result.field(FieldNames.PAN).orElseThrow().source());
        assertEquals("Acme Technologies Pvt Ltd", result.field(FieldNames.EMPLOYER).orElseThrow().value().asText());
        assertEquals(FieldSource.RULE_LINE, result.field(FieldNames.EMPLOYER).orElseThrow().source());
        assertEquals(new BigDecimal("1200000"), result.number(FieldNames.SALARY).orElseThrow());
        assertEquals(new BigDecimal("1050000"), result.number(FieldNames.TAXABLE_INCOME).orElseThrow());
        assertEquals(new BigDecimal("90000"), result.number(FieldNames.TDS).orElseThrow());
        assertEquals(new BigDecimal("150000"), result.number(FieldNames.DEDUCTIONS).orElseThrow());

        assertEquals(ExtractionQuality.GOOD, result.getQuality());
        assertTrue(result.getMessages().isEmpty());
        assertEquals(new BigDecimal("1200000"), result.getSummary().income());
        assertEquals(new BigDecimal("150000"), result.getSummary().deductions());
        assertEquals(new BigDecimal("1050000"), result.getSummary().taxableIncome());
        assertEquals("Form 16", result.getDeclaredTypeLabel());
    }

    @Test
    void extract_emptyTextIsUnreadableWithAdvisory() {
        ExtractionResult result = extractor.extract("", DocumentType.FORM_16, "Form 16");

        assertEquals(ExtractionQuality.UNREADABLE, result.getQuality());
        assertTrue(result.getFields().isEmpty());
        assertEquals(List.of(ExtractionQualityEvaluator.ADVISORY_MESSAGE), result.getMessages());
        assertEquals(0, result.getSummary().income().signum());
    }

    @Test
    void extract_unknownTypeRunsOnlyIdentityRules() {
        String text = "Statement for PAN ABCDE1234F\nGross Salary: 5,00,000";

        ExtractionResult result = extractor.extract(text, null, "Misc");

        assertEquals(1, result.getFields().size());
        assertTrue(result.hasField(FieldNames.PAN));
        assertFalse(result.hasField(FieldNames.SALARY));
        assertEquals(ExtractionQuality.LOW, result.getQuality());
        assertEquals(List.of(ExtractionQualityEvaluator.ADVISORY_MESSAGE), result.getMessages());
    }

    @Test
    void extract_firstMatchingLineWins() {
        String text = String.join("\n",
                "PAN ABCDE1234F",
                "Gross Salary: 8,00,000",
                "Gross Salary (revised): 9,00,000");

        ExtractionResult result = extractor.extract(text, DocumentType.SALARY_SLIP, "Salary Slip");

        assertEquals(new BigDecimal("800000"), result.number(FieldNames.SALARY).orElseThrow());
    }

    @Test
    void extract_annualStatement_readsReportedIncomeAndTds() {
        String text = String.join("\n",
                "Annual Tax Statement PAN ABCDE1234F",
                "Total Income reported: 9,80,000",
                "TDS credited: 75,000");

        ExtractionResult result = extractor.extract(text, DocumentType.ANNUAL_TAX_STATEMENT, "Form 26AS/AIS");

        assertEquals(new BigDecimal("75000"), result.number(FieldNames.TDS).orElseThrow());
        assertEquals(new BigDecimal("980000"), result.number(FieldNames.REPORTED_INCOME).orElseThrow());
        assertFalse(result.hasField(FieldNames.TAXABLE_INCOME));
        assertEquals(new BigDecimal("980000"), result.getSummary().taxableIncome());
        assertEquals(ExtractionQuality.GOOD, result.getQuality());
    }

    @Test
    void extract_investmentProofFillsEligible80c() {
        String text = String.join("\n",
                "Public Provident Fund receipt for the financial year",
                "PPF deduction amount 46,000 (80C)");

        ExtractionResult result = extractor.extract(text, DocumentType.INVESTMENT_PROOF, "Investment Proof");

        assertEquals(new BigDecimal("46000"), result.number(FieldNames.ELIGIBLE_80C).orElseThrow());
        assertEquals(new BigDecimal("46000"), result.getSummary().deductions());
        assertEquals(0, result.getSummary().taxableIncome().signum());
    }

    @Test
    void extract_dashSeparatedLabelsGivePositiveAmounts() {
        String text = String.join("\n", "PAN ABCDE1234F", "Gross Salary - 12,00,000", "TDS - 90,000");

        ExtractionResult result = extractor.extract(text, DocumentType.FORM_16, "Form 16");

        assertEquals(new BigDecimal("1200000"), result.number(FieldNames.SALARY).orElseThrow());
        assertEquals(new BigDecimal("90000"), result.number(FieldNames.TDS).orElseThrow());
        assertEquals(0, new BigDecimal("1200000").compareTo(result.getSummary().income()));
        assertEquals(0, new BigDecimal("1200000").compareTo(result.getSummary().taxableIncome()));
    }

    @Test
    void splitLines_dropsBlankLines() {
        assertEquals(List.of("a", "b"), HeuristicFieldExtractor.splitLines(" a \r\r\n\n b "));
    }
}
