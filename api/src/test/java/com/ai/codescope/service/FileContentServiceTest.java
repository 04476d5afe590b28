package com.ai.codescope.service;

import com.ai.codescope.config.CodescopeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class FileContentServiceTest {

    @TempDir
    Path root;

    private FileContentService service;

    @BeforeEach
    void setUp() {
        CodescopeProperties properties = new CodescopeProperties();
        properties.setMaxFileBytes(64);
        service = new FileContentService(properties);
    }

    @Test
    void testReadText_ReturnsUtf8Content() throws IOException {
        Files.writeString(root.resolve("hello.txt"), "héllo\n");

        assertEquals(Optional.of("héllo\n"), service.readText(root, "hello.txt"));
    }

    @Test
    void testReadText_RejectsPathsEscapingRoot() throws IOException {
        Path outside = Files.createTempFile("outside", ".txt");
        try {
            Files.writeString(outside, "secret");
            assertTrue(service.readText(root, "../" + outside.getFileName()).isEmpty());
            assertTrue(service.readText(root, outside.toString()).isEmpty());
            assertTrue(service.readText(root, "a\\b.txt").isEmpty());
        } finally {
            Files.deleteIfExists(outside);
        }
    }

    @Test
    void testReadText_UnavailableForInvalidUtf8OversizedOrMissing() throws IOException {
        Files.write(root.resolve("latin1.txt"), new byte[]{'c', 'a', 'f', (byte) 0xE9});
        Files.writeString(root.resolve("big.txt"), "x".repeat(65));

        assertTrue(service.readText(root, "latin1.txt").isEmpty());
        assertTrue(service.readText(root, "big.txt").isEmpty());
        assertTrue(service.readText(root, "missing.txt").isEmpty());
    }

    @Test
    void testIsTextEligible() throws IOException {
        Path text = Files.writeString(root.resolve("a.rs"), "fn main() {}");
        Path image = Files.writeString(root.resolve("a.png"), "plain bytes");
        Path withNul = Files.write(root.resolve("a.bin2"), new byte[]{'a', 0, 'b'});

        assertTrue(service.isTextEligible(text));
        assertFalse(service.isTextEligible(image));
        assertFalse(service.isTextEligible(withNul));
    }
}
