package com.lnradar.api.dto;

import java.util.Set;

public record ForbiddenWordResponse(boolean added, boolean resanitizeTriggered, Set<String> words) {
}
