package com.lnradar.api.controller;

import com.lnradar.api.dto.DonationsResponse;
import com.lnradar.api.dto.ErrorBody;
import com.lnradar.api.dto.UpdatesResponse;
import com.lnradar.api.dto.VoteRequest;
import com.lnradar.api.dto.VoteResponse;
import com.lnradar.domain.VoteCounts;
import com.lnradar.domain.VoteType;
import com.lnradar.donation.DonationSummaryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Public donation endpoints backing the donations page: summary, cheap change polling and votes.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DonationController {

    private final DonationSummaryService donationSummaryService;

    @GetMapping("/donations")
    public DonationsResponse donations() {
        return DonationsResponse.from(donationSummaryService.summary());
    }

    @GetMapping("/donations/updates")
    public UpdatesResponse updates() {
        return new UpdatesResponse(donationSummaryService.lastUpdate());
    }

    @PostMapping("/vote")
    public ResponseEntity<?> vote(@RequestBody @Valid VoteRequest request) {
        Optional<VoteType> voteType = VoteType.parse(request.voteType());
        if (voteType.isEmpty()) {
            return ResponseEntity.badRequest()
                    .body(ErrorBody.of("INVALID_VOTE_TYPE", "vote_type must be like or dislike"));
        }
        Optional<VoteCounts> counts = donationSummaryService.vote(request.donationId().strip(), voteType.get());
        if (counts.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorBody.of("DONATION_NOT_FOUND", "No donation with id " + request.donationId()));
        }
        return ResponseEntity.ok(new VoteResponse(counts.get().likes(), counts.get().dislikes()));
    }
}
