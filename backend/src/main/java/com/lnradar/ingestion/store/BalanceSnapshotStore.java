package com.lnradar.ingestion.store;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Last known balance (whole display units) per wallet tag, one scalar file per wallet. An absent file means the
 * wallet was never observed. Empty or unparseable content reads as zero so a poll cycle never fails on it.
 */
@Slf4j
public class BalanceSnapshotStore {

    private static final String FILE_PREFIX = "current-balance-";
    private static final String FILE_SUFFIX = ".txt";

    private final Path directory;
    private final Map<String, Long> mirror = new ConcurrentHashMap<>();
    private final ReentrantLock writeLock = new ReentrantLock();

    public BalanceSnapshotStore(Path directory) {
        this.directory = directory;
    }

    public Optional<Long> load(String walletTag) {
        Long cached = mirror.get(walletTag);
        if (cached != null) {
            return Optional.of(cached);
        }
        Path file = fileFor(walletTag);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        long value = readScalar(file);
        mirror.putIfAbsent(walletTag, value);
        return Optional.of(value);
    }

    /**
     * Persists the balance. A write failure is logged and the in-memory mirror still advances.
     */
    public void save(String walletTag, long balance) {
        writeLock.lock();
        try {
            mirror.put(walletTag, balance);
            try {
                writeScalar(fileFor(walletTag), balance);
                log.debug("Balance snapshot for {} saved: {}", walletTag, balance);
            } catch (IOException e) {
                log.error("Failed to save balance snapshot for {}: {}", walletTag, e.getMessage());
            }
        } finally {
            writeLock.unlock();
        }
    }

    Path fileFor(String walletTag) {
        return directory.resolve(FILE_PREFIX + walletTag + FILE_SUFFIX);
    }

    private long readScalar(Path file) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8).strip();
            if (content.isEmpty()) {
                log.warn("Balance file {} is empty; treating last balance as 0", file);
                return 0L;
            }
            // older files may hold a decimal such as "1234.0"
            return new BigDecimal(content).longValue();
        } catch (NumberFormatException e) {
            log.error("Invalid balance value in {}; treating last balance as 0", file);
            return 0L;
        } catch (IOException e) {
            log.error("Failed to read balance file {}: {}; treating last balance as 0", file, e.getMessage());
            return 0L;
        }
    }

    private void writeScalar(Path file, long balance) throws IOException {
        Files.createDirectories(directory);
        Path tmp = Files.createTempFile(directory, FILE_PREFIX, ".tmp");
        try {
            Files.writeString(tmp, Long.toString(balance), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
