package com.lnradar.api.dto;

public record VoteResponse(int likes, int dislikes) {
}
