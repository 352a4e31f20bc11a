package com.kmg.batch.repo;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kmg.batch.model.Ledger;
import com.kmg.batch.service.TimeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Reads and writes the ledger file. Writes go to a sibling temp file which is then moved over
 * the target, so a crash leaves either the previous or the new ledger on disk.
 */
@Repository
public class LedgerRepository {
    private static final Logger log = LoggerFactory.getLogger(LedgerRepository.class);

    private final ObjectMapper ledgerMapper;
    private final TimeService timeService;

    public LedgerRepository(ObjectMapper objectMapper, TimeService timeService) {
        this.ledgerMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.timeService = timeService;
    }

    /**
     * Loads the ledger at {@code file}, or returns an empty ledger bound to that path when the file
     * does not exist yet. Jobs recorded as running are kept as they are.
     */
    public Ledger load(Path file) {
        if (!Files.exists(file)) {
            return new Ledger(file);
        }
        try {
            Ledger ledger = ledgerMapper.readValue(file.toFile(), Ledger.class);
            ledger.setLocation(file);
            log.info("Loaded ledger {} with {} jobs", file, ledger.getJobs().size());
            return ledger;
        } catch (IOException e) {
            throw new LedgerPersistenceException("Failed to read ledger " + file + ": " + e.getMessage(), e);
        }
    }

    public synchronized void save(Ledger ledger) {
        Path target = ledger.getLocation();
        if (target == null) {
            throw new IllegalStateException("Ledger has no location");
        }
        ledger.setLastUpdated(timeService.now());
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            ledgerMapper.writeValue(temp.toFile(), ledger);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new LedgerPersistenceException("Failed to write ledger " + target + ": " + e.getMessage(), e);
        }
    }
}
