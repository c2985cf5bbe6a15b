package io.github.koszti.flinksqlgateway.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Stores endpoint definitions as a JSON document on disk.
 * <p>
 * Writes go to a sibling temp file first and are moved into place. An unreadable file is
 * logged and treated as empty.
 */
public class JsonFileEndpointRepository implements EndpointRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileEndpointRepository.class);

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileEndpointRepository(Path file, ObjectMapper objectMapper) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public synchronized StoredEndpoints load() {
        if (!Files.isRegularFile(file)) {
            return StoredEndpoints.empty();
        }
        try {
            StoredEndpoints stored = objectMapper.readValue(file.toFile(), StoredEndpoints.class);
            return stored == null ? StoredEndpoints.empty() : stored;
        } catch (IOException e) {
            log.error("Error loading gateway endpoints from {}: {}", file, e.toString());
            return StoredEndpoints.empty();
        }
    }

    @Override
    public synchronized void save(StoredEndpoints endpoints) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), endpoints);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to save gateway endpoints to " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }
}
