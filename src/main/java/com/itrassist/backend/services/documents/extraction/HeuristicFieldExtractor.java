package com.itrassist.backend.services.documents.extraction;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.itrassist.backend.entities.ExtractedField;
import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.entities.ExtractionSummary;
import com.itrassist.backend.entities.FieldNames;
import com.itrassist.backend.entities.FieldValue;
import com.itrassist.backend.enums.DocumentType;
import com.itrassist.backend.enums.ExtractionQuality;
import com.itrassist.backend.enums.FieldSource;

import lombok.extern.slf4j.Slf4j;

/**
 * Line-oriented rules that pull PAN, employer and amounts out of plain document text.
 *
 * Amount rules only look at "candidate" lines (a money keyword plus a digit). Within one rule the
 * first matching candidate wins, in order of appearance.
 */
@Slf4j
@Component
public class HeuristicFieldExtractor {

    private static final Pattern PAN = Pattern.compile("[A-Z]{5}[0-9]{4}[A-Z]");
    private static final Pattern EMPLOYER_LINE = Pattern.compile("employer|company|deductor", Pattern.CASE_INSENSITIVE);
    private static final Pattern EMPLOYER_PREFIX = Pattern.compile("^(Employer|Company|Deductor)\\s*[:\\-]\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern HAS_LETTER = Pattern.compile("[A-Za-z]");
    private static final Pattern CANDIDATE_KEYWORD = Pattern.compile("salary|gross|taxable|tds|deduction|income", Pattern.CASE_INSENSITIVE);
    private static final Pattern HAS_DIGIT = Pattern.compile("\\d");

    private static final AmountRule SALARY = rule(FieldNames.SALARY, "gross\\s*salary|total\\s*salary|income\\s*from\\s*salary", 0.9);
    private static final AmountRule TAXABLE = rule(FieldNames.TAXABLE_INCOME, "taxable\\s*income|total\\s*taxable", 0.85);
    private static final AmountRule TDS = rule(FieldNames.TDS, "tds|tax\\s+deducted", 0.8);
    private static final AmountRule DEDUCTIONS = rule(FieldNames.DEDUCTIONS, "deduction|80c|80d|80tta|investments", 0.7);

    private static final Map<DocumentType, List<AmountRule>> RULES = new EnumMap<>(DocumentType.class);

    static {
        List<AmountRule> salaryDocuments = List.of(SALARY, TAXABLE, TDS, DEDUCTIONS);
        RULES.put(DocumentType.FORM_16, salaryDocuments);
        RULES.put(DocumentType.SALARY_SLIP, salaryDocuments);
        RULES.put(DocumentType.ANNUAL_TAX_STATEMENT, List.of(
                TDS.withConfidence(0.9),
                rule(FieldNames.REPORTED_INCOME, "total\\s*income|reported\\s*income", 0.8),
                rule(FieldNames.TAXABLE_INCOME, "taxable\\s*income", 0.75)));
        RULES.put(DocumentType.INVESTMENT_PROOF, List.of(
                rule(FieldNames.ELIGIBLE_80C, "80c|ppf|elss|lic|nsc", 0.85)));
        RULES.put(DocumentType.BANK_STATEMENT, List.of(
                rule(FieldNames.INTEREST_INCOME, "interest\\s*income", 0.75)));
    }

    private final ExtractionQualityEvaluator qualityEvaluator;

    public HeuristicFieldExtractor(ExtractionQualityEvaluator qualityEvaluator) {
        this.qualityEvaluator = qualityEvaluator;
    }

    /**
     * @param text          plain text of the document, may be empty
     * @param declaredType  type chosen at upload; null runs only the PAN / employer rules
     * @param declaredLabel label as submitted, echoed in the result
     */
    public ExtractionResult extract(String text, DocumentType declaredType, String declaredLabel) {
        String source = text == null ? "" : text;
        List<String> lines = splitLines(source);
        List<ExtractedField> fields = new ArrayList<>();

        Matcher pan = PAN.matcher(source);
        if (pan.find()) {
            fields.add(new ExtractedField(FieldNames.PAN, FieldValue.ofText(pan.group()), 0.95, FieldSource.RULE_REGEX));
        }

        findEmployer(lines).ifPresent(name ->
                fields.add(new ExtractedField(FieldNames.EMPLOYER, FieldValue.ofText(name), 0.8, FieldSource.RULE_LINE)));

        List<String> candidates = lines.stream()
                .filter(l -> CANDIDATE_KEYWORD.matcher(l).find() && HAS_DIGIT.matcher(l).find())
                .collect(Collectors.toList());

        for (AmountRule rule : RULES.getOrDefault(declaredType, List.of())) {
            findAmount(candidates, rule).ifPresent(fields::add);
        }

        ExtractionQuality quality = qualityEvaluator.evaluate(source, fields);
        List<String> messages = quality == ExtractionQuality.GOOD
                ? List.of()
                : List.of(ExtractionQualityEvaluator.ADVISORY_MESSAGE);

        ExtractionResult withoutSummary = ExtractionResult.builder()
                .declaredType(declaredType)
                .declaredTypeLabel(declaredLabel)
                .quality(quality)
                .fields(fields)
                .messages(messages)
                .build();

        ExtractionResult result = withoutSummary.toBuilder()
                .summary(SummaryDeriver.derive(withoutSummary, ExtractionSummary.EMPTY))
                .build();

        log.info("[HeuristicExtractor] type={} lines={} fields={} quality={}",
                declaredType, lines.size(), fields.size(), quality);
        return result;
    }

    static List<String> splitLines(String text) {
        return Arrays.stream(text.replace('\r', '\n').split("\n+"))
                .map(String::trim)
                .filter(l -> !l.isEmpty())
                .collect(Collectors.toList());
    }

    private Optional<String> findEmployer(List<String> lines) {
        return lines.stream()
                .filter(l -> EMPLOYER_LINE.matcher(l).find())
                .findFirst()
                .map(l -> EMPLOYER_PREFIX.matcher(l).replaceFirst(""))
                .filter(name -> !name.isEmpty() && HAS_LETTER.matcher(name).find());
    }

    private Optional<ExtractedField> findAmount(List<String> candidates, AmountRule rule) {
        Optional<String> line = candidates.stream()
                .filter(l -> rule.label().matcher(l).find())
                .findFirst();
        if (line.isEmpty()) {
            log.debug("[HeuristicExtractor] ✗ {} not found", rule.fieldName());
            return Optional.empty();
        }

        Optional<BigDecimal> amount = AmountParser.parse(line.get());
        amount.ifPresent(a -> log.debug("[HeuristicExtractor] ✓ {} = {}", rule.fieldName(), a));
        return amount.map(a -> new ExtractedField(rule.fieldName(), FieldValue.ofNumber(a), rule.confidence(), FieldSource.RULE_REGEX));
    }

    private static AmountRule rule(String fieldName, String labelRegex, double confidence) {
        return new AmountRule(fieldName, Pattern.compile(labelRegex, Pattern.CASE_INSENSITIVE), confidence);
    }

    private record AmountRule(String fieldName, Pattern label, double confidence) {
        AmountRule withConfidence(double value) {
            return new AmountRule(fieldName, label, value);
        }
    }
}
