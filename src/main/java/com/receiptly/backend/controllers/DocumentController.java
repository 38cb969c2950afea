package com.receiptly.backend.controllers;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.receiptly.backend.dto.ApiResponse;
import com.receiptly.backend.dto.DocumentResponseDTO;
import com.receiptly.backend.dto.PagedResponseDTO;
import com.receiptly.backend.dto.ReviewRequestDTO;
import com.receiptly.backend.entities.Document;
import com.receiptly.backend.exceptions.BadRequestException;
import com.receiptly.backend.exceptions.ResourceNotFoundException;
import com.receiptly.backend.mappers.DocumentMapper;
import com.receiptly.backend.review.DocumentReviewService;
import com.receiptly.backend.services.DocumentProcessingService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
@Slf4j
public class DocumentController {

    private static final String OWNER_HEADER = "X-Owner-Id";

    private final DocumentProcessingService processingService;
    private final DocumentReviewService reviewService;

    @PostMapping
    public ResponseEntity<ApiResponse<DocumentResponseDTO>> upload(
            @RequestHeader(OWNER_HEADER) UUID ownerId,
            @RequestParam("file") MultipartFile file
    ) {
        if (file == null || file.isEmpty()) {
            throw new BadRequestException("File is missing or empty");
        }

        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new BadRequestException("Could not read uploaded file");
        }

        Document document = processingService.createDocument(ownerId, file.getOriginalFilename(), file.getContentType());
        processingService.startProcessing(document.getId(), bytes);
        log.info("[DocumentProcessing] queued documentId={} ownerId={} size={}", document.getId(), ownerId, bytes.length);

        return ResponseEntity.accepted()
                .body(ApiResponse.success(DocumentMapper.toResponseDTO(document), "Document queued for processing"));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<DocumentResponseDTO>>> list(@RequestHeader(OWNER_HEADER) UUID ownerId) {
        List<DocumentResponseDTO> documents = processingService.listForOwner(ownerId).stream()
                .map(DocumentMapper::toResponseDTO)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(documents, "Documents"));
    }

    @GetMapping("/review-queue")
    public ResponseEntity<ApiResponse<PagedResponseDTO<DocumentResponseDTO>>> reviewQueue(
            @RequestHeader(OWNER_HEADER) UUID ownerId,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset
    ) {
        Page<Document> page = reviewService.listReviewQueue(ownerId, limit, offset);
        PagedResponseDTO<DocumentResponseDTO> payload = new PagedResponseDTO<>(
                page.getContent().stream().map(DocumentMapper::toResponseDTO).toList(),
                page.getTotalElements(),
                page.getSize(),
                (int) page.getPageable().getOffset()
        );
        return ResponseEntity.ok(ApiResponse.success(payload, "Review queue"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<DocumentResponseDTO>> get(
            @RequestHeader(OWNER_HEADER) UUID ownerId,
            @PathVariable UUID id
    ) {
        Document document = processingService.findByIdForOwner(id, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Document not found"));
        return ResponseEntity.ok(ApiResponse.success(DocumentMapper.toResponseDTO(document), "Document"));
    }

    @PatchMapping("/{id}/review")
    public ResponseEntity<ApiResponse<DocumentResponseDTO>> review(
            @RequestHeader(OWNER_HEADER) UUID ownerId,
            @PathVariable UUID id,
            @Valid @RequestBody ReviewRequestDTO request
    ) {
        Document document = reviewService.review(ownerId, id, request);
        return ResponseEntity.ok(ApiResponse.success(DocumentMapper.toResponseDTO(document), "Review saved"));
    }
}
