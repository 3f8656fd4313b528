package com.emergence.physics.ledger.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes the latest snapshot as JSON to {@code <dir>/ledger-snapshot.json}. The file is written
 * to a temporary sibling first and moved into place, so readers never see a partial document.
 */
public final class JsonFileSnapshotSink implements SnapshotSink {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSnapshotSink.class);

    public static final String FILE_NAME = "ledger-snapshot.json";

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path directory;

    public JsonFileSnapshotSink(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public Path target() {
        return directory.resolve(FILE_NAME);
    }

    @Override
    public void write(LedgerSnapshot snapshot) {
        Path target = target();
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, "ledger-snapshot", ".tmp");
            try {
                MAPPER.writeValue(tmp.toFile(), snapshot);
                moveIntoPlace(tmp, target);
            } finally {
                Files.deleteIfExists(tmp);
            }
            log.debug("Snapshot written to {} | reason={} | events={}", target, snapshot.getReason(), snapshot.getEvents().size());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write snapshot to " + target, e);
        }
    }

    /** Reads the last written snapshot, if any. */
    public Optional<LedgerSnapshot> read() {
        Path target = target();
        if (!Files.isRegularFile(target)) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readValue(target.toFile(), LedgerSnapshot.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read snapshot " + target, e);
        }
    }

    @Override
    public String describe() {
        return "json-file:" + target();
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
