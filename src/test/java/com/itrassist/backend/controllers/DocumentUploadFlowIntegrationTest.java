package com.itrassist.backend.controllers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Upload, background extraction, review and correction through the real service stack.
 */
@SpringBootTest
@AutoConfigureMockMvc
class DocumentUploadFlowIntegrationTest {

    private static final String FORM_16 = String.join("\n",
            "FORM 16",
            "Employer: Acme Technologies Pvt Ltd",
            "PAN of Employee: ABCDE1234F",
            "Gross Salary: 12,00,000",
            "Deductions under Chapter VI-A: 1,50,000",
            "Total Taxable Income: 10,50,000",
            "Tax Deducted at Source (TDS): 90,000");

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Test
    void uploadedForm16_isExtractedAndCorrectable() throws Exception {
        String owner = "flow-" + UUID.randomUUID();
        MockMultipartFile file = new MockMultipartFile("file", "form16.txt", "text/plain",
                FORM_16.getBytes(StandardCharsets.UTF_8));

        MvcResult upload = mockMvc.perform(multipart("/api/documents/upload")
                        .file(file)
                        .param("docType", "Form 16")
                        .header(OwnerHeader.NAME, owner))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(true))
                .andReturn();

        String id = read(upload).path("data").path("id").asText();
        assertEquals("EXTRACTED", awaitTerminalStatus(id, owner));

        mockMvc.perform(get("/api/documents/{id}/data", id).header(OwnerHeader.NAME, owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.extracted.quality").value("good"))
                .andExpect(jsonPath("$.data.keySummary.Salary").value(1200000))
                .andExpect(jsonPath("$.data.needsReview").value(false));

        mockMvc.perform(post("/api/documents/{id}/corrections", id)
                        .header(OwnerHeader.NAME, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\":[{\"name\":\"TDS\",\"value\":\"95000\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Corrections applied"));

        mockMvc.perform(get("/api/documents/aggregate").header(OwnerHeader.NAME, owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.totalSalary").value(1200000))
                .andExpect(jsonPath("$.data.totalTDS").value(95000))
                .andExpect(jsonPath("$.data.documentsCounted").value(1));

        mockMvc.perform(get("/api/documents").header(OwnerHeader.NAME, owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1));
    }

    @Test
    void data_otherOwner_returnsNotFound() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "form16.txt", "text/plain",
                FORM_16.getBytes(StandardCharsets.UTF_8));

        MvcResult upload = mockMvc.perform(multipart("/api/documents/upload")
                        .file(file)
                        .header(OwnerHeader.NAME, "flow-owner-a"))
                .andExpect(status().isAccepted())
                .andReturn();
        String id = read(upload).path("data").path("id").asText();

        mockMvc.perform(get("/api/documents/{id}/data", id).header(OwnerHeader.NAME, "flow-owner-b"))
                .andExpect(status().isNotFound());
    }

    private String awaitTerminalStatus(String id, String owner) throws Exception {
        String current = "";
        for (int attempt = 0; attempt < 100; attempt++) {
            MvcResult result = mockMvc.perform(get("/api/documents/{id}/status", id).header(OwnerHeader.NAME, owner))
                    .andExpect(status().isOk())
                    .andReturn();
            current = read(result).path("data").path("status").asText();
            if ("EXTRACTED".equals(current) || "ERROR".equals(current)) {
                return current;
            }
            Thread.sleep(50);
        }
        return current;
    }

    private JsonNode read(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
