package com.receiptly.backend.classification;

import java.util.UUID;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.receiptly.backend.classification.dto.CategorizeRequestDTO;
import com.receiptly.backend.classification.dto.ReviewDiffRequestDTO;
import com.receiptly.backend.classification.dto.ReviewDiffResponseDTO;
import com.receiptly.backend.dto.ApiResponse;
import com.receiptly.backend.review.ChangeSet;
import com.receiptly.backend.review.ReviewDiffer;
import com.receiptly.backend.review.ReviewSnapshot;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/classification")
@RequiredArgsConstructor
public class ClassificationController {

    private final ClassificationService classificationService;
    private final ReviewDiffer reviewDiffer;

    @PostMapping("/categorize")
    public ResponseEntity<ApiResponse<CategoryResult>> categorize(
            @RequestHeader("X-Owner-Id") UUID ownerId,
            @Valid @RequestBody CategorizeRequestDTO request
    ) {
        CategoryResult result = classificationService.categorize(request.vendor(), request.description(), ownerId);
        String message = result.isEmpty() ? "No category matched" : "Category suggested";
        return ResponseEntity.ok(ApiResponse.success(result, message));
    }

    @PostMapping("/diff")
    public ResponseEntity<ApiResponse<ReviewDiffResponseDTO>> diff(@Valid @RequestBody ReviewDiffRequestDTO request) {
        ChangeSet changes = reviewDiffer.diff(
                ReviewSnapshot.fromMap(request.before()),
                ReviewSnapshot.fromMap(request.after())
        );
        return ResponseEntity.ok(ApiResponse.success(
                new ReviewDiffResponseDTO(changes.toMap(), changes.hasTaxonomyChange()),
                changes.isEmpty() ? "No changes" : "Changes detected"
        ));
    }
}
