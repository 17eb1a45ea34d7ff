package com.relationsim.relationship.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relationsim.common.exception.StateValidationException;
import com.relationsim.common.model.RelationshipSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stores relationship snapshots as versioned JSON documents, one file per named slot.
 *
 * <h3>Save</h3>
 * Written to a temp file in the same directory and moved into place atomically, so a crash
 * never leaves a half-written save. An I/O failure is retried once; after that the save is
 * skipped with an ERROR log and {@code false} is returned. Never throws.
 *
 * <h3>Load</h3>
 * Always yields a usable snapshot. A missing file, malformed JSON, a missing required field,
 * an unsupported major version or any out-of-range value all produce the documented default
 * state together with a {@link LoadStatus} the caller logs.
 */
@Component
public class PersistenceLayer {

    private static final Logger log = LoggerFactory.getLogger(PersistenceLayer.class);

    static final String COMPONENT = "PersistenceLayer";
    static final String EXTENSION = ".json";

    /** Top-level fields whose absence marks a document as corrupt. */
    static final List<String> REQUIRED_FIELDS = List.of(
        "trust_score",
        "resentment_score",
        "emotional_safety",
        "parenting_unity",
        "patterns",
        "emotional_memories",
        "apology_effectiveness"
    );

    private static final Pattern SLOT_NAME   = Pattern.compile("[A-Za-z0-9_-]+");
    private static final int     MAX_ATTEMPTS = 2;

    private final Path              directory;
    private final String            defaultSlot;
    private final ObjectMapper      objectMapper;
    private final SnapshotValidator validator;
    private final Clock             clock;

    public PersistenceLayer(@Value("${relationship.persistence.directory:saves}") String directory,
                            @Value("${relationship.persistence.slot:autosave}") String defaultSlot,
                            ObjectMapper objectMapper,
                            SnapshotValidator validator,
                            Clock clock) {
        this.directory    = Paths.get(directory);
        this.defaultSlot  = defaultSlot;
        this.objectMapper = objectMapper;
        this.validator    = validator;
        this.clock        = clock;
    }

    // ── save ────────────────────────────────────────────────────────────────

    public boolean save(RelationshipSnapshot snapshot) {
        return save(defaultSlot, snapshot);
    }

    /**
     * @return {@code true} if the document is on disk; {@code false} after a failed retry
     */
    public boolean save(String slot, RelationshipSnapshot snapshot) {
        Path target = resolve(slot);
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                write(target, snapshot);
                log.info("State saved. slot={} path={} attempt={} trust={} resentment={}",
                    slot, target, attempt, snapshot.trustScore(), snapshot.resentmentScore());
                return true;
            } catch (IOException e) {
                if (attempt < MAX_ATTEMPTS) {
                    log.warn("Save failed, retrying once. slot={} path={}", slot, target, e);
                } else {
                    log.error("Save failed after retry, continuing without persisting. slot={} path={}",
                        slot, target, e);
                }
            }
        }
        return false;
    }

    private void write(Path target, RelationshipSnapshot snapshot) throws IOException {
        Files.createDirectories(directory);
        Path tmp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    // ── load ────────────────────────────────────────────────────────────────

    public LoadResult load() {
        return load(defaultSlot);
    }

    public LoadResult load(String slot) {
        Path source = resolve(slot);
        if (!Files.exists(source)) {
            log.info("No saved state, starting from defaults. slot={} path={}", slot, source);
            return LoadResult.defaulted(defaults(), LoadStatus.DEFAULTED_MISSING, null);
        }
        try {
            JsonNode root = objectMapper.readTree(source.toFile());
            checkRequiredFields(root);
            RelationshipSnapshot snapshot = objectMapper.treeToValue(root, RelationshipSnapshot.class);
            validator.validate(snapshot);
            log.info("State loaded. slot={} version={} savedAt={} patterns={} memories={}",
                slot, snapshot.version(), snapshot.timestamp(),
                snapshot.patterns().size(), snapshot.emotionalMemories().size());
            return LoadResult.loaded(snapshot);
        } catch (StateValidationException | JsonProcessingException e) {
            log.warn("Saved state rejected, using defaults. slot={} reason={}", slot, e.getMessage());
            return LoadResult.defaulted(defaults(), LoadStatus.DEFAULTED_CORRUPT, e.getMessage());
        } catch (IOException e) {
            log.error("Saved state unreadable, using defaults. slot={} path={}", slot, source, e);
            return LoadResult.defaulted(defaults(), LoadStatus.DEFAULTED_IO_ERROR, e.getMessage());
        }
    }

    private void checkRequiredFields(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new StateValidationException(COMPONENT, "document", "not a JSON object");
        }
        for (String field : REQUIRED_FIELDS) {
            JsonNode node = root.get(field);
            if (node == null || node.isNull()) {
                throw new StateValidationException(COMPONENT, field, "required field missing");
            }
        }
    }

    // ── slots ───────────────────────────────────────────────────────────────

    /** Slot names with a save on disk, sorted. Empty when the directory does not exist. */
    public List<String> listSaves() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .map(p -> p.getFileName().toString())
                .filter(name -> name.endsWith(EXTENSION))
                .map(name -> name.substring(0, name.length() - EXTENSION.length()))
                .sorted()
                .toList();
        } catch (IOException e) {
            log.warn("Could not list saves. directory={}", directory, e);
            return List.of();
        }
    }

    /** @return {@code true} if a save existed and was removed */
    public boolean deleteSave(String slot) {
        Path target = resolve(slot);
        try {
            boolean deleted = Files.deleteIfExists(target);
            if (deleted) {
                log.info("Save deleted. slot={} path={}", slot, target);
            }
            return deleted;
        } catch (IOException e) {
            log.warn("Could not delete save. slot={} path={}", slot, target, e);
            return false;
        }
    }

    public String getDefaultSlot() {
        return defaultSlot;
    }

    private Path resolve(String slot) {
        if (slot == null || !SLOT_NAME.matcher(slot).matches()) {
            throw new IllegalArgumentException("Invalid save slot name: " + slot);
        }
        return directory.resolve(slot + EXTENSION);
    }

    private RelationshipSnapshot defaults() {
        return RelationshipSnapshot.defaults(clock.instant());
    }
}
