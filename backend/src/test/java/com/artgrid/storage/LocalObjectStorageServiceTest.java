package com.artgrid.storage;

import com.artgrid.config.ArtgridProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LocalObjectStorageService Unit Tests")
class LocalObjectStorageServiceTest {

    @TempDir
    Path tempDir;

    private LocalObjectStorageService storageService;

    @BeforeEach
    void setUp() {
        ArtgridProperties properties = new ArtgridProperties();
        properties.getStorage().setLocalDir(tempDir.toString());
        storageService = new LocalObjectStorageService(properties);
    }

    @Test
    @DisplayName("store should write the file under the key and return its public path")
    void testStore() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "a.png", "image/png", new byte[]{7, 8, 9});

        String url = storageService.store("artworks/abc.png", file);

        assertEquals("/uploads/artworks/abc.png", url);
        Path stored = tempDir.resolve("artworks/abc.png");
        assertTrue(Files.exists(stored));
        assertArrayEquals(new byte[]{7, 8, 9}, Files.readAllBytes(stored));
    }

    @Test
    @DisplayName("store should refuse keys escaping the root directory")
    void testStore_PathTraversal() {
        MockMultipartFile file = new MockMultipartFile("file", "a.png", "image/png", new byte[]{1});

        assertThrows(IllegalArgumentException.class, () -> storageService.store("../outside.png", file));
        assertFalse(Files.exists(tempDir.resolveSibling("outside.png")));
    }
}
