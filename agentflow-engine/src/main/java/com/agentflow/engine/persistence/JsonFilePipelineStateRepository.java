package com.agentflow.engine.persistence;

import com.agentflow.core.exception.CorruptStateException;
import com.agentflow.core.exception.PersistenceException;
import com.agentflow.core.model.PipelineState;
import com.agentflow.core.repository.PipelineStateRepository;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Stores one JSON snapshot per task under a directory: {@code <dir>/<taskId>.json}.
 *
 * Writes go to a temporary file that is then moved over the snapshot, so a crash mid-write
 * leaves the previous snapshot intact. Snapshots are never deleted.
 */
public class JsonFilePipelineStateRepository implements PipelineStateRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFilePipelineStateRepository.class);

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonFilePipelineStateRepository(Path directory) {
        this(directory, defaultObjectMapper());
    }

    public JsonFilePipelineStateRepository(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new PersistenceException(null, "Cannot create snapshot directory " + directory, e);
        }
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public void save(PipelineState state) {
        Path target = pathFor(state.taskId());
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), state);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new PersistenceException(state.taskId(),
                "Failed to write snapshot for task " + state.taskId(), e);
        }
    }

    @Override
    public Optional<PipelineState> findById(String taskId) {
        Path path = pathFor(taskId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(read(taskId, path));
    }

    @Override
    public List<String> findActiveTaskIds() {
        List<String> active = new ArrayList<>();
        for (Path path : snapshotFiles()) {
            String taskId = taskIdOf(path);
            try {
                if (!read(taskId, path).isTerminal()) {
                    active.add(taskId);
                }
            } catch (CorruptStateException e) {
                // Reported as active so the caller surfaces the corruption when loading it
                active.add(taskId);
            }
        }
        return active;
    }

    @Override
    public List<PipelineState> findArchivedSince(Instant since) {
        List<PipelineState> archived = new ArrayList<>();
        for (Path path : snapshotFiles()) {
            try {
                PipelineState state = read(taskIdOf(path), path);
                if (state.isArchived() && !state.archivedAt().isBefore(since)) {
                    archived.add(state);
                }
            } catch (CorruptStateException e) {
                log.warn("Skipping unreadable snapshot {}: {}", path.getFileName(), e.getMessage());
            }
        }
        archived.sort(Comparator.comparing(PipelineState::archivedAt));
        return archived;
    }

    @Override
    public long count() {
        return snapshotFiles().size();
    }

    public Path directory() {
        return directory;
    }

    private PipelineState read(String taskId, Path path) {
        try {
            PipelineState state = objectMapper.readValue(path.toFile(), PipelineState.class);
            if (state == null) {
                throw new CorruptStateException(taskId, "empty snapshot");
            }
            return state;
        } catch (IOException | IllegalArgumentException | NullPointerException e) {
            throw new CorruptStateException(taskId, "unreadable snapshot " + path.getFileName(), e);
        }
    }

    private List<Path> snapshotFiles() {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            stream.forEach(files::add);
        } catch (IOException e) {
            throw new PersistenceException(null, "Cannot list snapshot directory " + directory, e);
        }
        return files;
    }

    /**
     * @throws PersistenceException if the id would resolve outside the snapshot directory
     */
    private Path pathFor(String taskId) {
        Path root = directory.toAbsolutePath().normalize();
        Path path = root.resolve(taskId + SUFFIX).normalize();
        if (!path.startsWith(root) || !root.equals(path.getParent())) {
            throw new PersistenceException(taskId, "Task id does not map to a snapshot file: " + taskId);
        }
        return path;
    }

    private static String taskIdOf(Path path) {
        String name = path.getFileName().toString();
        return name.substring(0, name.length() - SUFFIX.length());
    }
}
