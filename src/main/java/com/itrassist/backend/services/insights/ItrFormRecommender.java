package com.itrassist.backend.services.insights;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.itrassist.backend.entities.TaxDocument;
import com.itrassist.backend.enums.DocumentType;
import com.itrassist.backend.enums.ItrFormType;

/**
 * Suggests which ITR form fits the income sources seen in a filer's extracted documents.
 * Checked in priority order: business, capital gains, rent, then whether any salary document exists.
 */
@Component
public class ItrFormRecommender {

    public ItrRecommendation recommend(List<TaxDocument> documents) {
        Set<DocumentType> types = EnumSet.noneOf(DocumentType.class);
        for (TaxDocument d : documents) {
            if (d.isExtracted() && d.getDeclaredType() != null) {
                types.add(d.getDeclaredType());
            }
        }

        if (types.contains(DocumentType.BUSINESS_INCOME_DOCUMENT)) {
            return ItrRecommendation.of(ItrFormType.ITR_3, "Income from business/profession.");
        }
        if (types.contains(DocumentType.CAPITAL_GAINS_REPORT)) {
            return ItrRecommendation.of(ItrFormType.ITR_2, "Capital gains income present.");
        }
        if (types.contains(DocumentType.RENT_RECEIPT)) {
            return ItrRecommendation.of(ItrFormType.ITR_2, "Income from house property (rent) likely.");
        }
        if (!types.contains(DocumentType.FORM_16) && !types.contains(DocumentType.SALARY_SLIP)) {
            return ItrRecommendation.of(ItrFormType.ITR_2, "Multiple income sources detected.");
        }
        return ItrRecommendation.of(ItrFormType.ITR_1, "Income from salary and/or interest only.");
    }
}
