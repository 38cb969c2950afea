package com.receiptly.backend.classification.dto;

import java.util.Map;

public record ReviewDiffResponseDTO(
        Map<String, Map<String, Object>> changes,
        boolean taxonomyChanged
) {}
