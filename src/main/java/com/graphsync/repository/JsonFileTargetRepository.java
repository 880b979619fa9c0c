package com.graphsync.repository;

import com.graphsync.exception.SourceDataException;
import com.graphsync.util.FileWriteUtil;
import com.graphsync.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * In-memory repository persisted to one JSON file. The file is rewritten on every commit that changed something.
 */
public class JsonFileTargetRepository extends InMemoryTargetRepository {
    private static final Logger log = LoggerFactory.getLogger(JsonFileTargetRepository.class);

    private final Path file;

    private JsonFileTargetRepository(Path file, RepositoryState state) {
        super(state, null);
        this.file = file;
    }

    /**
     * Opens the repository stored in {@code file}, or a new empty one if the file does not exist yet.
     */
    public static JsonFileTargetRepository open(Path file) {
        if (!Files.exists(file)) {
            log.info("Creating new repository at {}", file);
            return new JsonFileTargetRepository(file, null);
        }
        try {
            RepositoryState state = JsonSupport.mapper().readValue(file.toFile(), RepositoryState.class);
            log.info("Opened repository {} ({} records, {} changesets)", file, state.getRecords().size(),
                    state.getChangesets().size());
            return new JsonFileTargetRepository(file, state);
        } catch (IOException e) {
            throw new SourceDataException("Failed to read repository file", file, e);
        }
    }

    @Override
    protected void onCommitted(RepositoryState state) {
        try {
            FileWriteUtil.replaceString(file, JsonSupport.toPrettyJson(state));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write repository file " + file, e);
        }
        log.debug("Flushed repository to {}", file);
    }

    public Path getFile() {
        return file;
    }
}
