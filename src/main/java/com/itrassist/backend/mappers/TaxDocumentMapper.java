package com.itrassist.backend.mappers;

import java.util.List;
import java.util.stream.Collectors;

import com.itrassist.backend.dto.CorrectionRequestDTO;
import com.itrassist.backend.dto.DocumentDataResponseDTO;
import com.itrassist.backend.dto.DocumentListItemDTO;
import com.itrassist.backend.dto.DocumentStatusResponseDTO;
import com.itrassist.backend.dto.DocumentUploadResponseDTO;
import com.itrassist.backend.entities.ExtractionResult;
import com.itrassist.backend.entities.TaxDocument;
import com.itrassist.backend.services.documents.DocumentData;
import com.itrassist.backend.services.documents.corrections.FieldCorrection;

public class TaxDocumentMapper {

    private TaxDocumentMapper() {}

    public static DocumentUploadResponseDTO toUploadResponse(TaxDocument document) {
        return DocumentUploadResponseDTO.builder()
                .id(document.getId())
                .status(document.getStatus())
                .name(document.getOriginalFileName())
                .mimeType(document.getMimeType())
                .size(document.getByteSize())
                .docType(document.getDeclaredType())
                .docTypeLabel(document.getDeclaredTypeLabel())
                .uploadedAt(document.getUploadedAt())
                .build();
    }

    public static DocumentStatusResponseDTO toStatusResponse(TaxDocument document) {
        return DocumentStatusResponseDTO.builder()
                .id(document.getId())
                .status(document.getStatus())
                .error(document.getError())
                .processedAt(document.getProcessedAt())
                .build();
    }

    public static DocumentListItemDTO toListItem(TaxDocument document) {
        ExtractionResult extracted = document.getExtracted();
        return DocumentListItemDTO.builder()
                .id(document.getId())
                .name(document.getOriginalFileName())
                .mimeType(document.getMimeType())
                .size(document.getByteSize())
                .docType(document.getDeclaredType())
                .docTypeLabel(document.getDeclaredTypeLabel())
                .status(document.getStatus())
                .quality(extracted != null ? extracted.getQuality() : null)
                .error(document.getError())
                .uploadedAt(document.getUploadedAt())
                .build();
    }

    public static List<DocumentListItemDTO> toListItems(List<TaxDocument> documents) {
        return documents.stream().map(TaxDocumentMapper::toListItem).collect(Collectors.toList());
    }

    public static DocumentDataResponseDTO toDataResponse(DocumentData data) {
        TaxDocument document = data.document();
        ExtractionResult extracted = document.getExtracted();
        return DocumentDataResponseDTO.builder()
                .id(document.getId())
                .docType(document.getDeclaredType())
                .docTypeLabel(document.getDeclaredTypeLabel())
                .status(document.getStatus())
                .error(document.getError())
                .summary(extracted != null ? extracted.getSummary() : null)
                .extracted(extracted)
                .keySummary(data.keySummary())
                .canonicalExport(data.canonicalExport())
                .findings(data.findings())
                .manualFields(data.manualFields())
                .missingRequiredFields(data.missingRequiredFields())
                .needsReview(data.needsReview())
                .build();
    }

    public static List<FieldCorrection> toCorrections(CorrectionRequestDTO request) {
        if (request == null || request.fields() == null) return List.of();
        return request.fields().stream()
                .map(f -> FieldCorrection.of(f.name(), f.value()))
                .collect(Collectors.toList());
    }
}
