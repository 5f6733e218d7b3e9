package com.catalogenricher.enrichment.progress;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * JSON checkpoint files, written to a temp file in the same directory and moved into place.
 */
@Component
@Slf4j
public class JsonCheckpointStore implements CheckpointStore {

    private final ObjectMapper mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    @Override
    public boolean exists(Path path) {
        return path != null && Files.isRegularFile(path);
    }

    @Override
    public CheckpointSnapshot read(Path path) {
        try {
            CheckpointSnapshot snapshot = mapper.readValue(path.toFile(), CheckpointSnapshot.class);
            if (snapshot.version() > CheckpointSnapshot.CURRENT_VERSION) {
                throw new CheckpointException("Unsupported checkpoint version " + snapshot.version() + " in " + path, null);
            }
            return snapshot;
        } catch (IOException e) {
            throw new CheckpointException("Failed to read checkpoint " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void write(Path path, CheckpointSnapshot snapshot) {
        Path tmp = null;
        try {
            Path dir = path.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            mapper.writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new CheckpointException("Failed to write checkpoint " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(Path path) {
        try {
            if (Files.deleteIfExists(path)) {
                log.info("Removed checkpoint {}", path);
            }
        } catch (IOException e) {
            throw new CheckpointException("Failed to delete checkpoint " + path + ": " + e.getMessage(), e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not remove temp checkpoint {}: {}", tmp, e.getMessage());
        }
    }
}
