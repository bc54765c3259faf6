package com.lnradar.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Attributed donation held by the donation ledger. Mutated only by votes and memo re-sanitization.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Donation {

    @EqualsAndHashCode.Include
    private String id;
    @JsonProperty("date")
    private Instant timestamp;
    private String memo;
    private long amount;
    private int likes;
    private int dislikes;

    public Donation(String id, Instant timestamp, String memo, long amount) {
        this.id = id;
        this.timestamp = timestamp;
        this.memo = memo;
        this.amount = amount;
    }

    public Donation copy() {
        Donation d = new Donation(id, timestamp, memo, amount);
        d.setLikes(likes);
        d.setDislikes(dislikes);
        return d;
    }
}
