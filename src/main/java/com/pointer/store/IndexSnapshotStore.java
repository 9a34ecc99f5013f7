package com.pointer.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class IndexSnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(IndexSnapshotStore.class);

    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public IndexState load(Path path) throws IOException {
        if (!Files.exists(path)) {
            log.info("index.load path={} status=missing", path);
            return IndexState.empty();
        }
        IndexState state = mapper.readValue(path.toFile(), IndexState.class);
        if (state.version() > IndexState.CURRENT_VERSION) {
            throw new IllegalStateException("index snapshot version " + state.version() + " is newer than supported "
                    + IndexState.CURRENT_VERSION + ": " + path);
        }
        log.info("index.load path={} blobs={} chunks={} files={}", path, state.blobs().size(), state.chunks().size(), state.files().size());
        return state;
    }

    public void save(Path path, IndexState state) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.info("index.save path={} blobs={} chunks={} files={}", path, state.blobs().size(), state.chunks().size(), state.files().size());
    }
}
