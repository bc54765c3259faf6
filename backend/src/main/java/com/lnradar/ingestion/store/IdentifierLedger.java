package com.lnradar.ingestion.store;

import com.lnradar.domain.EventIdentifier;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only set of already-processed payment identifiers ({@code {walletTag}_{paymentHash}}, one per line).
 * The in-memory set is rebuilt from the file at construction. Reads are lock-free; {@link #record} holds the
 * writer lock for the check-append-publish sequence. No deletion exists.
 */
@Slf4j
public class IdentifierLedger {

    private final Path file;
    private final Set<String> seen = ConcurrentHashMap.newKeySet();
    private final ReentrantLock writeLock = new ReentrantLock();

    public IdentifierLedger(Path file) {
        this.file = file;
        load();
    }

    public boolean has(EventIdentifier id) {
        return seen.contains(id.value());
    }

    /**
     * Appends the identifier unless already present. A write failure is logged and the in-memory set still
     * advances, so a restart may redeliver this identifier's event (at-least-once).
     *
     * @return true if the identifier was new
     */
    public boolean record(EventIdentifier id) {
        String value = id.value();
        writeLock.lock();
        try {
            if (seen.contains(value)) {
                return false;
            }
            try {
                append(value);
            } catch (IOException e) {
                log.error("Failed to persist processed identifier {} to {}: {}", value, file, e.getMessage());
            }
            seen.add(value);
            log.debug("Recorded processed identifier {}", value);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    public int size() {
        return seen.size();
    }

    private void append(String value) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
            w.write(value);
            w.newLine();
        }
    }

    private void load() {
        if (!Files.exists(file)) {
            log.info("Identifier ledger {} does not exist yet; starting empty", file);
            return;
        }
        try {
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            for (String line : lines) {
                String value = line.strip();
                if (!value.isEmpty()) {
                    seen.add(value);
                }
            }
            log.info("Loaded {} processed identifiers from {}", seen.size(), file);
        } catch (IOException e) {
            throw new LedgerPersistenceException("Cannot read identifier ledger " + file, e);
        }
    }
}
