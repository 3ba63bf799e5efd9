package com.itrassist.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.itrassist.backend.dto.ApiResponse;
import com.itrassist.backend.dto.ItrFormRequestDTO;
import com.itrassist.backend.dto.ItrSubmitResponseDTO;
import com.itrassist.backend.dto.ItrValidationResponseDTO;
import com.itrassist.backend.entities.ItrForm;
import com.itrassist.backend.mappers.ItrFormMapper;
import com.itrassist.backend.services.itr.ItrFormService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/itr")
@RequiredArgsConstructor
public class ItrFormController {

    private final ItrFormService itrFormService;

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ItrForm>> get(
            @RequestHeader(value = OwnerHeader.NAME, defaultValue = OwnerHeader.DEFAULT_OWNER) String ownerId,
            @PathVariable String id
    ) {
        return ResponseEntity.ok(ApiResponse.success(itrFormService.getOrCreate(id, ownerId), "ITR form"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ItrForm>> update(
            @RequestHeader(value = OwnerHeader.NAME, defaultValue = OwnerHeader.DEFAULT_OWNER) String ownerId,
            @PathVariable String id,
            @Valid @RequestBody ItrFormRequestDTO request
    ) {
        ItrForm updated = itrFormService.update(id, ownerId, ItrFormMapper.toEntity(request));
        return ResponseEntity.ok(ApiResponse.success(updated, "ITR form updated"));
    }

    @PostMapping("/{id}/validate")
    public ResponseEntity<ApiResponse<ItrValidationResponseDTO>> validate(
            @RequestHeader(value = OwnerHeader.NAME, defaultValue = OwnerHeader.DEFAULT_OWNER) String ownerId,
            @PathVariable String id
    ) {
        ItrValidationResponseDTO payload = ItrFormMapper.toValidationResponse(itrFormService.validate(id, ownerId));
        return ResponseEntity.ok(ApiResponse.success(payload, "ITR form validated"));
    }

    @PostMapping("/{id}/submit")
    public ResponseEntity<ApiResponse<ItrSubmitResponseDTO>> submit(
            @RequestHeader(value = OwnerHeader.NAME, defaultValue = OwnerHeader.DEFAULT_OWNER) String ownerId,
            @PathVariable String id
    ) {
        ItrSubmitResponseDTO payload = ItrFormMapper.toSubmitResponse(itrFormService.submit(id, ownerId));
        return ResponseEntity.ok(ApiResponse.success(payload, payload.getMessage()));
    }
}
