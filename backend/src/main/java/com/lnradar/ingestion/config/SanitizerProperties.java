package com.lnradar.ingestion.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Memo sanitizer settings. The word list is only the startup value; words added at runtime live in
 * {@link com.lnradar.ingestion.filter.ForbiddenWordRegistry}.
 */
@ConfigurationProperties(prefix = "lnradar.sanitizer")
@Validated
@Getter
@Setter
public class SanitizerProperties {

    private List<String> forbiddenWords = new ArrayList<>();

    /** Replaces empty or absent memos. */
    @NotBlank
    private String placeholder = "No memo";
}
