package com.lnradar.ingestion.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.lnradar.domain.Donation;
import com.lnradar.domain.DonationLedgerView;
import com.lnradar.domain.VoteCounts;
import com.lnradar.domain.VoteType;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Attributed donations plus their running total, persisted as one JSON document
 * {@code {"total_donations": n, "donations": [...]}}. Every mutation rewrites the whole document through a temp
 * file and an atomic move, so a crash never leaves total and list out of step. All mutations hold the lock for the
 * full read-modify-write-persist sequence; reads return copies.
 */
@Slf4j
public class DonationLedger {

    private final Path file;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final List<Donation> donations = new ArrayList<>();
    private long total;
    private volatile Instant lastUpdate;

    public DonationLedger(Path file, ObjectMapper objectMapper, Clock clock) {
        this.file = file;
        this.mapper = objectMapper.copy()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.clock = clock;
        this.lastUpdate = clock.instant();
        load();
    }

    public void append(Donation donation) {
        if (donation.getAmount() < 0) {
            throw new IllegalArgumentException("donation amount must not be negative");
        }
        lock.lock();
        try {
            Donation stored = donation.copy();
            if (stored.getId() == null || stored.getId().isBlank()) {
                stored.setId(UUID.randomUUID().toString());
            }
            donations.add(stored);
            total += stored.getAmount();
            lastUpdate = clock.instant();
            persist();
            log.info("New donation recorded: {} - \"{}\" (total {})", stored.getAmount(), stored.getMemo(), total);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Increments like or dislike on the donation. Duplicate-vote prevention belongs to the caller.
     */
    public Optional<VoteCounts> vote(String donationId, VoteType voteType) {
        lock.lock();
        try {
            Optional<Donation> target = donations.stream()
                    .filter(d -> d.getId().equals(donationId))
                    .findFirst();
            if (target.isEmpty()) {
                return Optional.empty();
            }
            Donation d = target.get();
            if (voteType == VoteType.LIKE) {
                d.setLikes(d.getLikes() + 1);
            } else {
                d.setDislikes(d.getDislikes() + 1);
            }
            persist();
            return Optional.of(new VoteCounts(d.getLikes(), d.getDislikes()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rewrites every stored memo through {@code sanitizer}. Persists once if anything changed.
     *
     * @return number of memos changed
     */
    public int resanitize(UnaryOperator<String> sanitizer) {
        lock.lock();
        try {
            int changed = 0;
            for (Donation d : donations) {
                String updated = sanitizer.apply(d.getMemo());
                if (updated != null && !updated.equals(d.getMemo())) {
                    d.setMemo(updated);
                    changed++;
                }
            }
            if (changed > 0) {
                persist();
            }
            return changed;
        } finally {
            lock.unlock();
        }
    }

    public DonationLedgerView view() {
        lock.lock();
        try {
            List<Donation> copies = donations.stream().map(Donation::copy).toList();
            return new DonationLedgerView(total, copies, lastUpdate);
        } finally {
            lock.unlock();
        }
    }

    public Instant lastUpdate() {
        return lastUpdate;
    }

    private void persist() {
        LedgerDocument doc = new LedgerDocument(total, donations);
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path tmp = Files.createTempFile(parent, "donations-", ".tmp");
            try {
                mapper.writeValue(tmp.toFile(), doc);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
            log.debug("Donation ledger saved ({} donations)", donations.size());
        } catch (IOException e) {
            log.error("Failed to save donation ledger to {}: {}", file, e.getMessage());
        }
    }

    private void load() {
        if (!Files.exists(file)) {
            log.info("Donation ledger {} does not exist yet; starting empty", file);
            return;
        }
        LedgerDocument doc;
        try {
            doc = mapper.readValue(file.toFile(), LedgerDocument.class);
        } catch (IOException e) {
            throw new LedgerPersistenceException("Cannot read donation ledger " + file, e);
        }
        if (doc.donations() != null) {
            for (Donation d : doc.donations()) {
                if (d.getId() == null || d.getId().isBlank()) {
                    d.setId(UUID.randomUUID().toString());
                }
                donations.add(d);
            }
        }
        long sum = donations.stream().mapToLong(Donation::getAmount).sum();
        if (sum != doc.totalDonations()) {
            log.warn("Donation ledger total {} does not match sum of donations {}; using the sum",
                    doc.totalDonations(), sum);
        }
        total = sum;
        log.info("Loaded {} donations (total {}) from {}", donations.size(), total, file);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LedgerDocument(
            @JsonProperty("total_donations") long totalDonations,
            @JsonProperty("donations") List<Donation> donations
    ) {
    }
}
