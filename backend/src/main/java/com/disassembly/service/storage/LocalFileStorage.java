package com.disassembly.service.storage;

import com.disassembly.config.CompositionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link FileStorage} on the local file system, rooted at {@code composition.storage.root}.
 */
@Component
@Slf4j
public class LocalFileStorage implements FileStorage {

    private final Path root;

    public LocalFileStorage(CompositionProperties properties) {
        this.root = Path.of(properties.getStorage().getRoot()).toAbsolutePath().normalize();
    }

    @Override
    public void delete(String storagePath) throws IOException {
        Path target = resolve(storagePath);
        if (Files.deleteIfExists(target)) {
            log.debug("Deleted stored file {}", target);
        } else {
            log.debug("Stored file {} was already gone", target);
        }
    }

    Path resolve(String storagePath) {
        Path target = root.resolve(storagePath).normalize();
        if (!target.startsWith(root)) {
            throw new IllegalArgumentException("Storage path escapes the storage root: " + storagePath);
        }
        return target;
    }
}
