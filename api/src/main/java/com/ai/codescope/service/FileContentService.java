package com.ai.codescope.service;

import com.ai.codescope.config.CodescopeProperties;
import com.ai.codescope.model.ContentSource;
import com.ai.codescope.model.Languages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads repository files as text. Anything that is binary, oversized, outside the
 * repository root or not valid UTF-8 is reported as unavailable rather than failing.
 */
@Service
public class FileContentService {

    private static final Logger log = LoggerFactory.getLogger(FileContentService.class);

    private static final int SNIFF_BYTES = 8192;

    private final CodescopeProperties properties;

    public FileContentService(CodescopeProperties properties) {
        this.properties = properties;
    }

    /**
     * Content source reading lazily from disk below {@code root}.
     */
    public ContentSource contentSource(Path root) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        return path -> readText(normalizedRoot, path);
    }

    /**
     * Check if a file is eligible for the index: not a known binary type and no NUL byte
     * in its first 8 KiB.
     */
    public boolean isTextEligible(Path file) {
        if (file == null || file.getFileName() == null) {
            return false;
        }
        if (Languages.isBinaryExtension(file.getFileName().toString())) {
            return false;
        }
        try (InputStream in = Files.newInputStream(file)) {
            byte[] head = in.readNBytes(SNIFF_BYTES);
            for (byte b : head) {
                if (b == 0) {
                    return false;
                }
            }
            return true;
        } catch (IOException e) {
            log.debug("[FileContentService] Cannot sniff {}: {}", file, e.getMessage());
            return false;
        }
    }

    /**
     * Read a file below {@code root} as strict UTF-8.
     *
     * @param root         normalized absolute repository root
     * @param relativePath slash-separated path relative to the root
     * @return file content, or empty if unavailable
     */
    public Optional<String> readText(Path root, String relativePath) {
        Optional<Path> resolved = resolveInside(root, relativePath);
        if (resolved.isEmpty()) {
            log.warn("[FileContentService] Rejected path outside repository: {}", relativePath);
            return Optional.empty();
        }

        Path file = resolved.get();
        try {
            if (!Files.isRegularFile(file) || Files.size(file) > properties.getMaxFileBytes()) {
                return Optional.empty();
            }
            byte[] bytes = Files.readAllBytes(file);
            return decode(bytes);
        } catch (IOException e) {
            log.warn("[FileContentService] Read failed for {}: {}", relativePath, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Resolve a relative path against the root, refusing anything that escapes it.
     */
    public Optional<Path> resolveInside(Path root, String relativePath) {
        if (relativePath == null || relativePath.isBlank() || relativePath.startsWith("/")
                || relativePath.contains("\\")) {
            return Optional.empty();
        }
        Path base = root.toAbsolutePath().normalize();
        Path resolved = base.resolve(relativePath).normalize();
        return resolved.startsWith(base) && !resolved.equals(base) ? Optional.of(resolved) : Optional.empty();
    }

    static Optional<String> decode(byte[] bytes) {
        for (byte b : bytes) {
            if (b == 0) {
                return Optional.empty();
            }
        }
        try {
            return Optional.of(StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }
}
