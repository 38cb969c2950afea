package com.receiptly.backend.controllers;

import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.receiptly.backend.dto.ApiResponse;
import com.receiptly.backend.dto.CandidateDTO;
import com.receiptly.backend.dto.DraftCandidatesDTO;
import com.receiptly.backend.dto.PagedResponseDTO;
import com.receiptly.backend.dto.ReceiptDraftRequestDTO;
import com.receiptly.backend.dto.ReceiptDraftResultDTO;
import com.receiptly.backend.dto.TransactionResponseDTO;
import com.receiptly.backend.mappers.TransactionMapper;
import com.receiptly.backend.reconciliation.CandidateMatcher;
import com.receiptly.backend.reconciliation.DraftCandidates;
import com.receiptly.backend.reconciliation.ReceiptDraftResult;
import com.receiptly.backend.reconciliation.ReceiptDraftService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/reconciliation/receipt-drafts")
@RequiredArgsConstructor
public class ReconciliationController {

    private static final String OWNER_HEADER = "X-Owner-Id";

    private final ReceiptDraftService receiptDraftService;
    private final CandidateMatcher candidateMatcher;

    @PostMapping
    public ResponseEntity<ApiResponse<ReceiptDraftResultDTO>> createDraft(
            @RequestHeader(OWNER_HEADER) UUID ownerId,
            @Valid @RequestBody ReceiptDraftRequestDTO request
    ) {
        ReceiptDraftResult result = receiptDraftService.createReceiptDraftForDocument(ownerId, request.documentId());
        HttpStatus status = result.duplicated() ? HttpStatus.OK : HttpStatus.CREATED;
        String message = result.duplicated() ? "Receipt draft already exists" : "Receipt draft created";
        return ResponseEntity.status(status).body(ApiResponse.success(TransactionMapper.toDraftResultDTO(result), message));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<PagedResponseDTO<DraftCandidatesDTO>>> listUnmatched(
            @RequestHeader(OWNER_HEADER) UUID ownerId,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset,
            @RequestParam(value = "candidateLimit", required = false) Integer candidateLimit
    ) {
        Page<DraftCandidates> page = candidateMatcher.listUnmatchedDrafts(ownerId, limit, offset, candidateLimit);
        PagedResponseDTO<DraftCandidatesDTO> payload = new PagedResponseDTO<>(
                page.getContent().stream().map(TransactionMapper::toDraftCandidatesDTO).toList(),
                page.getTotalElements(),
                page.getSize(),
                (int) page.getPageable().getOffset()
        );
        return ResponseEntity.ok(ApiResponse.success(payload, "Unmatched receipt drafts"));
    }

    @GetMapping("/{draftId}/candidates")
    public ResponseEntity<ApiResponse<List<CandidateDTO>>> candidates(
            @RequestHeader(OWNER_HEADER) UUID ownerId,
            @PathVariable UUID draftId,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        List<CandidateDTO> candidates = candidateMatcher.listCandidates(ownerId, draftId, limit).stream()
                .map(TransactionMapper::toCandidateDTO)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(candidates, "Candidates"));
    }

    @PostMapping("/{draftId}/candidates/{candidateId}/ignore")
    public ResponseEntity<ApiResponse<TransactionResponseDTO>> ignoreCandidate(
            @RequestHeader(OWNER_HEADER) UUID ownerId,
            @PathVariable UUID draftId,
            @PathVariable UUID candidateId
    ) {
        var draft = candidateMatcher.ignoreCandidate(ownerId, draftId, candidateId);
        return ResponseEntity.ok(ApiResponse.success(TransactionMapper.toResponseDTO(draft), "Candidate ignored"));
    }

    @PostMapping("/{draftId}/candidates/{candidateId}/accept")
    public ResponseEntity<ApiResponse<TransactionResponseDTO>> acceptCandidate(
            @RequestHeader(OWNER_HEADER) UUID ownerId,
            @PathVariable UUID draftId,
            @PathVariable UUID candidateId
    ) {
        var draft = candidateMatcher.acceptCandidate(ownerId, draftId, candidateId);
        return ResponseEntity.ok(ApiResponse.success(TransactionMapper.toResponseDTO(draft), "Candidate accepted"));
    }

    @PostMapping("/{draftId}/ignore")
    public ResponseEntity<ApiResponse<TransactionResponseDTO>> ignoreDraft(
            @RequestHeader(OWNER_HEADER) UUID ownerId,
            @PathVariable UUID draftId
    ) {
        var draft = candidateMatcher.ignoreDraft(ownerId, draftId);
        return ResponseEntity.ok(ApiResponse.success(TransactionMapper.toResponseDTO(draft), "Draft ignored"));
    }
}
