package com.receiptly.backend.classification.dto;

import jakarta.validation.constraints.Size;

public record CategorizeRequestDTO(
        @Size(max = 255) String vendor,
        @Size(max = 1000) String description
) {}
