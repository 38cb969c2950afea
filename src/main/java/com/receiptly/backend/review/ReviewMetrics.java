package com.receiptly.backend.review;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.receiptly.backend.enums.ReviewStatus;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Review meters. Exported by the Prometheus registry as {@code ocr_review_completion_seconds}
 * and {@code ocr_manual_overrides_total}.
 */
@Component
public class ReviewMetrics {

    static final String REVIEW_COMPLETION = "ocr.review.completion";
    static final String MANUAL_OVERRIDES = "ocr.manual.overrides";
    static final String STATUS_TAG = "review_status";

    private final MeterRegistry meterRegistry;
    private final Timer reviewCompletion;

    public ReviewMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.reviewCompletion = Timer.builder(REVIEW_COMPLETION)
                .description("Time from document upload to review completion")
                .serviceLevelObjectives(
                        Duration.ofMinutes(1),
                        Duration.ofMinutes(2),
                        Duration.ofMinutes(5),
                        Duration.ofMinutes(10),
                        Duration.ofMinutes(30),
                        Duration.ofHours(1),
                        Duration.ofHours(2),
                        Duration.ofHours(6),
                        Duration.ofHours(12),
                        Duration.ofHours(24))
                .register(meterRegistry);
    }

    public void reviewCompleted(LocalDateTime uploadedAt, LocalDateTime reviewedAt, ReviewStatus status) {
        if (uploadedAt != null && reviewedAt != null) {
            Duration elapsed = Duration.between(uploadedAt, reviewedAt);
            if (!elapsed.isNegative()) {
                reviewCompletion.record(elapsed);
            }
        }
        // only corrections override what the pipeline extracted
        if (status == ReviewStatus.CORRECTED) {
            overrides(status).increment();
        }
    }

    private Counter overrides(ReviewStatus status) {
        return Counter.builder(MANUAL_OVERRIDES)
                .description("Manual overrides of extracted fields by review status")
                .tag(STATUS_TAG, status.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry);
    }
}
