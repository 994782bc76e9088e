package com.riskmodels.client;

import com.riskmodels.exception.ArtifactStorageException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Stores each artifact as an immutable file named by a random handle. Writes go to a temp
 * file first and are moved into place, so a reader never sees a partial artifact.
 */
@Slf4j
@Component
public class FileSystemArtifactStore implements ArtifactStore {

    private static final Pattern HANDLE_PATTERN = Pattern.compile("^[a-f0-9-]{36}\\.bin$");

    @Value("${artifacts.root:./data/artifacts}")
    private String rootDirectory;

    private Path root;

    @PostConstruct
    void init() {
        root = Paths.get(rootDirectory).toAbsolutePath().normalize();
        try {
            Files.createDirectories(root);
        } catch (IOException ex) {
            throw new ArtifactStorageException("Cannot create artifact directory " + root, ex);
        }
        log.info("FileSystemArtifactStore initialised → {}", root);
    }

    @Override
    public String put(byte[] content) {
        String handle = newHandle();
        Path target = root.resolve(handle);
        Path tmp = null;
        try {
            tmp = Files.createTempFile(root, "upload-", ".tmp");
            Files.write(tmp, content);
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            deleteQuietly(tmp);
            throw new ArtifactStorageException("Failed to write artifact " + handle, ex);
        }
        log.debug("Artifact stored | handle={} | bytes={}", handle, content.length);
        return handle;
    }

    @Override
    public byte[] get(String handle) {
        try {
            return Files.readAllBytes(resolve(handle));
        } catch (IOException ex) {
            throw new ArtifactStorageException("Failed to read artifact " + handle, ex);
        }
    }

    @Override
    public void delete(String handle) {
        try {
            if (Files.deleteIfExists(resolve(handle))) {
                log.debug("Artifact deleted | handle={}", handle);
            }
        } catch (IOException ex) {
            throw new ArtifactStorageException("Failed to delete artifact " + handle, ex);
        }
    }

    String newHandle() {
        return UUID.randomUUID() + ".bin";
    }

    private Path resolve(String handle) {
        if (handle == null || !HANDLE_PATTERN.matcher(handle).matches()) {
            throw new ArtifactStorageException("Invalid artifact handle: " + handle, null);
        }
        return root.resolve(handle);
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException ex) {
            log.warn("Temp artifact not removed | path={} | reason={}", tmp, ex.getMessage());
        }
    }
}
