package com.receiptly.backend.services.ocr;

import java.util.Locale;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;

@Configuration
@EnableConfigurationProperties(OcrProperties.class)
@Slf4j
public class OcrConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "receiptly.ocr", name = "enabled", havingValue = "true")
    public TextExtractor textExtractor(OcrProperties ocrProperties) {
        String provider = ocrProperties.getProvider() == null
                ? ""
                : ocrProperties.getProvider().trim().toLowerCase(Locale.ROOT);

        if (GoogleVisionTextExtractor.PROVIDER.equals(provider)) {
            log.info("[OCR] Enabled: provider='{}' projectId='{}'",
                    provider, safe(ocrProperties.getGoogleVision().getProjectId()));
            return new GoogleVisionTextExtractor(ocrProperties.getGoogleVision());
        }
        throw new IllegalStateException("Unsupported OCR provider: '" + provider + "'");
    }

    @Bean
    @ConditionalOnMissingBean(TextExtractor.class)
    public TextExtractor disabledTextExtractor() {
        log.info("[OCR] Disabled (receiptly.ocr.enabled=false)");
        return new DisabledTextExtractor();
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
