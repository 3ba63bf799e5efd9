package com.itrassist.backend.mappers;

import java.math.BigDecimal;

import com.itrassist.backend.dto.ItrFormRequestDTO;
import com.itrassist.backend.dto.ItrSubmitResponseDTO;
import com.itrassist.backend.dto.ItrValidationResponseDTO;
import com.itrassist.backend.entities.ItrForm;
import com.itrassist.backend.services.itr.ItrSubmission;
import com.itrassist.backend.services.itr.ItrValidationResult;

public class ItrFormMapper {

    private ItrFormMapper() {}

    /**
     * Editable sections only; id, owner and lifecycle fields are filled in by the service.
     */
    public static ItrForm toEntity(ItrFormRequestDTO dto) {
        return ItrForm.builder()
                .income(ItrForm.Income.builder()
                        .salary(nz(dto.income().salary()))
                        .interest(nz(dto.income().interest()))
                        .rentalIncome(nz(dto.income().rentalIncome()))
                        .otherIncome(nz(dto.income().otherIncome()))
                        .build())
                .deductions(ItrForm.Deductions.builder()
                        .section80C(nz(dto.deductions().section80C()))
                        .section80D(nz(dto.deductions().section80D()))
                        .charitableDonations(nz(dto.deductions().charitableDonations()))
                        .build())
                .investments(ItrForm.Investments.builder()
                        .ppf(nz(dto.investments().ppf()))
                        .elss(nz(dto.investments().elss()))
                        .nps(nz(dto.investments().nps()))
                        .build())
                .taxesPaid(ItrForm.TaxesPaid.builder()
                        .tds(nz(dto.taxesPaid().tds()))
                        .advanceTax(nz(dto.taxesPaid().advanceTax()))
                        .selfAssessmentTax(nz(dto.taxesPaid().selfAssessmentTax()))
                        .build())
                .notes(dto.notes())
                .build();
    }

    public static ItrValidationResponseDTO toValidationResponse(ItrValidationResult result) {
        return new ItrValidationResponseDTO(result.issues(),
                new ItrValidationResponseDTO.Totals(result.totalIncome(), result.totalDeductions()));
    }

    public static ItrSubmitResponseDTO toSubmitResponse(ItrSubmission submission) {
        ItrValidationResult validation = submission.validation();
        return ItrSubmitResponseDTO.builder()
                .id(submission.form().getId())
                .status(submission.form().getStatus())
                .message(submission.message())
                .submittedAt(submission.form().getSubmittedAt())
                .issues(validation.issues())
                .totals(new ItrValidationResponseDTO.Totals(validation.totalIncome(), validation.totalDeductions()))
                .build();
    }

    private static BigDecimal nz(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
