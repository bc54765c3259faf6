package com.lnradar.domain;

public record VoteCounts(int likes, int dislikes) {
}
