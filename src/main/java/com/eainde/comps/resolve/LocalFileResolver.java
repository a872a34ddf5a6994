package com.eainde.comps.resolve;

import com.eainde.comps.model.FileReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Reads referenced files from a local directory tree ({@code comps.files.root}).
 *
 * <p>References are paths relative to the root; a reference that points outside the root
 * is rejected.</p>
 */
@Slf4j
@Component
public class LocalFileResolver implements FileResolver {

    private final Path root;

    public LocalFileResolver(@Value("${comps.files.root:./data}") String root) {
        this.root = Path.of(root).toAbsolutePath().normalize();
        log.info("Resolving files under {}", this.root);
    }

    @Override
    public FileReference resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new FileResolutionException("Empty file reference");
        }

        Path path;
        try {
            path = root.resolve(reference.strip()).normalize();
        } catch (InvalidPathException e) {
            throw new FileResolutionException("Invalid path: " + reference, e);
        }
        if (!path.startsWith(root)) {
            throw new FileResolutionException("Path escapes the files root: " + reference);
        }
        if (!Files.isRegularFile(path)) {
            throw new FileResolutionException("File not found: " + reference);
        }

        try {
            byte[] content = Files.readAllBytes(path);
            log.debug("Read {} bytes from {}", content.length, path);
            return FileReference.resolved(reference, path.getFileName().toString(), content);
        } catch (IOException e) {
            throw new FileResolutionException("Cannot read " + reference + ": " + e.getMessage(), e);
        }
    }
}
