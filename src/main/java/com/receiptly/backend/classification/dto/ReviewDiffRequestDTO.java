package com.receiptly.backend.classification.dto;

import java.util.Map;

import jakarta.validation.constraints.NotNull;

/**
 * Two loosely typed field maps keyed by field name (vendor_name, total_amount, ...).
 */
public record ReviewDiffRequestDTO(
        @NotNull Map<String, Object> before,
        @NotNull Map<String, Object> after
) {}
