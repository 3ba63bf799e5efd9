package com.itrassist.backend.services.insights;

import com.itrassist.backend.enums.ItrFormType;

public record ItrRecommendation(ItrFormType form, String formLabel, String reason) {

    public static ItrRecommendation of(ItrFormType form, String reason) {
        return new ItrRecommendation(form, form.getLabel(), reason);
    }
}
