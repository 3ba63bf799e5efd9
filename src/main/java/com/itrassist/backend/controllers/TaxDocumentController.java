package com.itrassist.backend.controllers;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.itrassist.backend.dto.ApiResponse;
import com.itrassist.backend.dto.CorrectionRequestDTO;
import com.itrassist.backend.dto.DocumentDataResponseDTO;
import com.itrassist.backend.dto.DocumentListItemDTO;
import com.itrassist.backend.dto.DocumentStatusResponseDTO;
import com.itrassist.backend.dto.DocumentUploadResponseDTO;
import com.itrassist.backend.entities.TaxDocument;
import com.itrassist.backend.exceptions.IngestException;
import com.itrassist.backend.mappers.TaxDocumentMapper;
import com.itrassist.backend.services.aggregate.FilerAggregate;
import com.itrassist.backend.services.documents.DocumentInsights;
import com.itrassist.backend.services.documents.TaxDocumentService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class TaxDocumentController {

    private final TaxDocumentService documentService;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<DocumentUploadResponseDTO>> upload(
            @RequestHeader(value = OwnerHeader.NAME, defaultValue = OwnerHeader.DEFAULT_OWNER) String ownerId,
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "docType", required = false) String docType
    ) {
        if (file == null || file.isEmpty()) {
            throw new IngestException("Uploaded file is missing or empty");
        }

        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new IngestException("Could not read uploaded file", e);
        }

        String filename = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload";
        TaxDocument document = documentService.ingest(ownerId, bytes, file.getContentType(), docType, filename);

        return ResponseEntity.accepted()
                .body(ApiResponse.success(TaxDocumentMapper.toUploadResponse(document), "Document queued for extraction"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<DocumentListItemDTO>>> list(
            @RequestHeader(value = OwnerHeader.NAME, defaultValue = OwnerHeader.DEFAULT_OWNER) String ownerId
    ) {
        List<DocumentListItemDTO> items = TaxDocumentMapper.toListItems(documentService.list(ownerId));
        return ResponseEntity.ok(ApiResponse.success(items, "Documents"));
    }

    @GetMapping("/{id}/status")
    public ResponseEntity<ApiResponse<DocumentStatusResponseDTO>> status(
            @RequestHeader(value = OwnerHeader.NAME, defaultValue = OwnerHeader.DEFAULT_OWNER) String ownerId,
            @PathVariable UUID id
    ) {
        TaxDocument document = documentService.getStatus(id, ownerId);
        return ResponseEntity.ok(ApiResponse.success(TaxDocumentMapper.toStatusResponse(document), "Document status"));
    }

    @GetMapping("/{id}/data")
    public ResponseEntity<ApiResponse<DocumentDataResponseDTO>> data(
            @RequestHeader(value = OwnerHeader.NAME, defaultValue = OwnerHeader.DEFAULT_OWNER) String ownerId,
            @PathVariable UUID id
    ) {
        DocumentDataResponseDTO payload = TaxDocumentMapper.toDataResponse(documentService.getData(id, ownerId));
        return ResponseEntity.ok(ApiResponse.success(payload, "Document data"));
    }

    @PostMapping("/{id}/corrections")
    public ResponseEntity<ApiResponse<DocumentDataResponseDTO>> corrections(
            @RequestHeader(value = OwnerHeader.NAME, defaultValue = OwnerHeader.DEFAULT_OWNER) String ownerId,
            @PathVariable UUID id,
            @Valid @RequestBody CorrectionRequestDTO request
    ) {
        documentService.applyCorrections(id, ownerId, TaxDocumentMapper.toCorrections(request));
        DocumentDataResponseDTO payload = TaxDocumentMapper.toDataResponse(documentService.getData(id, ownerId));
        return ResponseEntity.ok(ApiResponse.success(payload, "Corrections applied"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(
            @RequestHeader(value = OwnerHeader.NAME, defaultValue = OwnerHeader.DEFAULT_OWNER) String ownerId,
            @PathVariable UUID id
    ) {
        documentService.delete(id, ownerId);
        return ResponseEntity.ok(ApiResponse.success(null, "Document deleted"));
    }

    @GetMapping("/aggregate")
    public ResponseEntity<ApiResponse<FilerAggregate>> aggregate(
            @RequestHeader(value = OwnerHeader.NAME, defaultValue = OwnerHeader.DEFAULT_OWNER) String ownerId
    ) {
        return ResponseEntity.ok(ApiResponse.success(documentService.getAggregate(ownerId), "Tax summary"));
    }

    @GetMapping("/insights")
    public ResponseEntity<ApiResponse<DocumentInsights>> insights(
            @RequestHeader(value = OwnerHeader.NAME, defaultValue = OwnerHeader.DEFAULT_OWNER) String ownerId
    ) {
        return ResponseEntity.ok(ApiResponse.success(documentService.getInsights(ownerId), "Document insights"));
    }
}
