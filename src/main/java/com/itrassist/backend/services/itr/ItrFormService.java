package com.itrassist.backend.services.itr;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Objects;

import org.springframework.stereotype.Service;

import com.itrassist.backend.config.TaxRulesProperties;
import com.itrassist.backend.entities.ItrForm;
import com.itrassist.backend.enums.ItrFormStatus;
import com.itrassist.backend.exceptions.ConflictException;
import com.itrassist.backend.exceptions.ResourceNotFoundException;
import com.itrassist.backend.repositories.ItrFormRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Lifecycle of the consolidated ITR form: lazy creation with seed values, full replace-update,
 * validation and submission.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ItrFormService {

    static final String SUBMITTED_MESSAGE = "Submitted for review";

    private final ItrFormRepository itrFormRepository;
    private final ItrValidationEngine validationEngine;
    private final TaxRulesProperties taxRules;

    public ItrForm getOrCreate(String formId, String ownerId) {
        ItrForm form = itrFormRepository.findOrCreate(formId, () -> seed(formId, ownerId));
        return ownedBy(form, ownerId);
    }

    /**
     * Replaces every editable section. Id, owner, status and submission time are kept.
     */
    public ItrForm update(String formId, String ownerId, ItrForm replacement) {
        ItrForm existing = find(formId, ownerId);

        ItrForm updated = replacement.toBuilder()
                .id(existing.getId())
                .ownerId(existing.getOwnerId())
                .income(replacement.getIncome() != null ? replacement.getIncome() : existing.getIncome())
                .deductions(replacement.getDeductions() != null ? replacement.getDeductions() : existing.getDeductions())
                .investments(replacement.getInvestments() != null ? replacement.getInvestments() : existing.getInvestments())
                .taxesPaid(replacement.getTaxesPaid() != null ? replacement.getTaxesPaid() : existing.getTaxesPaid())
                .status(existing.getStatus())
                .submittedAt(existing.getSubmittedAt())
                .updatedAt(LocalDateTime.now())
                .build();

        log.info("[ItrFormService] form={} updated", formId);
        return itrFormRepository.save(updated);
    }

    public ItrValidationResult validate(String formId, String ownerId) {
        return validationEngine.validate(find(formId, ownerId));
    }

    public ItrSubmission submit(String formId, String ownerId) {
        ItrForm form = find(formId, ownerId);
        ItrValidationResult validation = validationEngine.validate(form);

        if (validation.hasIssues() && taxRules.blockSubmissionOnIssues()) {
            log.info("[ItrFormService] form={} submission blocked: {} issue(s)", formId, validation.issues().size());
            throw new ConflictException("ITR form has " + validation.issues().size() + " unresolved validation issue(s)");
        }

        form.setStatus(ItrFormStatus.SUBMITTED);
        form.setSubmittedAt(LocalDateTime.now());
        form.setUpdatedAt(form.getSubmittedAt());
        ItrForm saved = itrFormRepository.save(form);

        log.info("[ItrFormService] form={} submitted with {} advisory issue(s)", formId, validation.issues().size());
        return new ItrSubmission(saved, validation, SUBMITTED_MESSAGE);
    }

    private ItrForm find(String formId, String ownerId) {
        return itrFormRepository.findById(formId)
                .map(form -> ownedBy(form, ownerId))
                .orElseThrow(() -> new ResourceNotFoundException("ITR form not found"));
    }

    private static ItrForm ownedBy(ItrForm form, String ownerId) {
        if (!Objects.equals(form.getOwnerId(), ownerId)) {
            throw new ResourceNotFoundException("ITR form not found");
        }
        return form;
    }

    static ItrForm seed(String formId, String ownerId) {
        return ItrForm.builder()
                .id(formId)
                .ownerId(ownerId)
                .income(ItrForm.Income.builder()
                        .salary(amount(1_200_000))
                        .interest(amount(15_000))
                        .rentalIncome(BigDecimal.ZERO)
                        .otherIncome(amount(5_000))
                        .build())
                .deductions(ItrForm.Deductions.builder()
                        .section80C(amount(150_000))
                        .section80D(amount(25_000))
                        .charitableDonations(amount(10_000))
                        .build())
                .investments(ItrForm.Investments.builder()
                        .ppf(amount(60_000))
                        .elss(amount(40_000))
                        .nps(amount(20_000))
                        .build())
                .taxesPaid(ItrForm.TaxesPaid.builder()
                        .tds(amount(90_000))
                        .advanceTax(amount(10_000))
                        .selfAssessmentTax(BigDecimal.ZERO)
                        .build())
                .notes("Imported from extracted documents.")
                .status(ItrFormStatus.DRAFT)
                .updatedAt(LocalDateTime.now())
                .build();
    }

    private static BigDecimal amount(long value) {
        return BigDecimal.valueOf(value);
    }
}
