package com.lnradar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record UpdatesResponse(@JsonProperty("last_update") Instant lastUpdate) {
}
