package com.lnradar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record VoteRequest(
        @JsonProperty("donation_id") @NotBlank(message = "MISSING_DONATION_ID") String donationId,
        @JsonProperty("vote_type") @NotBlank(message = "INVALID_VOTE_TYPE") String voteType
) {
}
