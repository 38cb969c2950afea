package com.receiptly.backend.dto;

import java.util.List;

public record PagedResponseDTO<T>(List<T> items, long total, int limit, int offset) {
}
