package com.itrassist.backend.controllers;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class ItrFormControllerIntegrationTest {

    private static final String OWNER = "itr-filer";

    @Autowired
    MockMvc mockMvc;

    private static String newFormId() {
        return "itr-" + UUID.randomUUID();
    }

    private static String formBody(long salary, long section80C, long tds) {
        return String.join("\n",
                "{",
                "  \"income\": {\"salary\": " + salary + ", \"interest\": 0, \"rentalIncome\": 0, \"otherIncome\": 0},",
                "  \"deductions\": {\"section80C\": " + section80C + ", \"section80D\": 0, \"charitableDonations\": 0},",
                "  \"investments\": {\"ppf\": 0, \"elss\": 0, \"nps\": 0},",
                "  \"taxesPaid\": {\"tds\": " + tds + ", \"advanceTax\": 0, \"selfAssessmentTax\": 0},",
                "  \"notes\": \"checked\"",
                "}");
    }

    @Test
    void get_unknownForm_createsSeededDraft() throws Exception {
        String id = newFormId();

        mockMvc.perform(get("/api/itr/{id}", id).header(OwnerHeader.NAME, OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").value(id))
                .andExpect(jsonPath("$.data.status").value("DRAFT"))
                .andExpect(jsonPath("$.data.income.salary").value(1200000))
                .andExpect(jsonPath("$.data.deductions.section80C").value(150000));
    }

    @Test
    void get_otherOwnersForm_returnsNotFound() throws Exception {
        String id = newFormId();
        mockMvc.perform(get("/api/itr/{id}", id).header(OwnerHeader.NAME, OWNER))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/itr/{id}", id).header(OwnerHeader.NAME, "someone-else"))
                .andExpect(status().isNotFound());
    }

    @Test
    void update_negativeSalary_returnsBadRequest() throws Exception {
        String id = newFormId();
        mockMvc.perform(get("/api/itr/{id}", id).header(OwnerHeader.NAME, OWNER));

        mockMvc.perform(put("/api/itr/{id}", id)
                        .header(OwnerHeader.NAME, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(formBody(-1, 0, 0)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Validation error"));
    }

    @Test
    void update_thenValidate_reportsIssuesAndTotals() throws Exception {
        String id = newFormId();
        mockMvc.perform(get("/api/itr/{id}", id).header(OwnerHeader.NAME, OWNER));

        mockMvc.perform(put("/api/itr/{id}", id)
                        .header(OwnerHeader.NAME, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(formBody(500000, 200000, 0)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.income.salary").value(500000))
                .andExpect(jsonPath("$.data.notes").value("checked"));

        mockMvc.perform(post("/api/itr/{id}/validate", id).header(OwnerHeader.NAME, OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.issues[0].code").value("LIMIT_80C"))
                .andExpect(jsonPath("$.data.issues[0].field").value("deductions.section80C"))
                .andExpect(jsonPath("$.data.totals.totalIncome").value(500000))
                .andExpect(jsonPath("$.data.totals.totalDeductions").value(200000));
    }

    @Test
    void submit_cleanForm_marksSubmitted() throws Exception {
        String id = newFormId();
        mockMvc.perform(get("/api/itr/{id}", id).header(OwnerHeader.NAME, OWNER));

        mockMvc.perform(post("/api/itr/{id}/submit", id).header(OwnerHeader.NAME, OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Submitted for review"))
                .andExpect(jsonPath("$.data.status").value("SUBMITTED"))
                .andExpect(jsonPath("$.data.issues").isEmpty());
    }

    @Test
    void update_missingForm_returnsNotFound() throws Exception {
        mockMvc.perform(put("/api/itr/{id}", newFormId())
                        .header(OwnerHeader.NAME, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(formBody(100, 0, 0)))
                .andExpect(status().isNotFound());
    }
}
