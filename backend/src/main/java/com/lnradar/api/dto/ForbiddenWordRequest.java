package com.lnradar.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * @param resanitize also rewrite memos already stored in the donation ledger
 */
public record ForbiddenWordRequest(@NotBlank(message = "MISSING_WORD") String word, boolean resanitize) {
}
