package com.ryuqq.provisioner.adapter.file.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.provisioner.core.exception.StateStoreException;
import com.ryuqq.provisioner.core.model.DeploymentRecord;
import com.ryuqq.provisioner.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * {@link StateStore} persisting the deployment record as one pretty-printed JSON document.
 *
 * <p><strong>Crash safety:</strong> {@link #save(DeploymentRecord)} writes to a temporary
 * file in the target directory and moves it over the target with
 * {@code ATOMIC_MOVE + REPLACE_EXISTING}. A crash leaves either the old or the new file,
 * plus at worst an orphaned temporary file.</p>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>missing file: {@link #load()} returns empty</li>
 *   <li>unparseable or invalid content: {@link StateStoreException}</li>
 *   <li>I/O failure: {@link StateStoreException}</li>
 * </ul>
 *
 * <p>Single writer only.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class FileStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(FileStateStore.class);

    private final Path path;
    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * @param path state file location (parent directories are created on first save)
     * @throws IllegalArgumentException if path is null
     */
    public FileStateStore(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        this.path = path.toAbsolutePath();
    }

    @Override
    public Optional<DeploymentRecord> load() {
        if (!Files.exists(path)) {
            log.debug("No state file at {}", path);
            return Optional.empty();
        }
        try {
            byte[] content = Files.readAllBytes(path);
            if (content.length == 0) {
                throw new StateStoreException("State file is empty: " + path, null);
            }
            StateDocument document = mapper.readValue(content, StateDocument.class);
            return Optional.of(document.toRecord());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StateStoreException("State file is corrupt: " + path, e);
        } catch (IOException e) {
            throw new StateStoreException("Cannot read state file: " + path, e);
        }
    }

    @Override
    public void save(DeploymentRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        Path directory = path.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
            Files.write(temp, mapper.writeValueAsBytes(StateDocument.from(record)));
            move(temp, path);
            log.debug("Saved state ({} resources) to {}", record.resources().size(), path);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StateStoreException("Cannot write state file: " + path, e);
        }
    }

    @Override
    public void clear() {
        try {
            if (Files.deleteIfExists(path)) {
                log.info("Removed state file {}", path);
            }
        } catch (IOException e) {
            throw new StateStoreException("Cannot remove state file: " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to plain replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Cannot remove temporary state file {}", temp, e);
        }
    }
}
