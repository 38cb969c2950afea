package com.receiptly.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.receiptly.backend.classification.rules.KeywordRules;

@Configuration
public class ClassificationConfig {

    @Bean
    public KeywordRules keywordRules() {
        return KeywordRules.DEFAULT;
    }
}
