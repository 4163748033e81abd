package com.artgrid.service;

import com.artgrid.config.ArtgridProperties;
import com.artgrid.dto.response.ArtworkResponse;
import com.artgrid.dto.response.ArtworkUploadResponse;
import com.artgrid.entity.Artwork;
import com.artgrid.entity.User;
import com.artgrid.exception.ResourceNotFoundException;
import com.artgrid.exception.StorageException;
import com.artgrid.repository.ArtworkRepository;
import com.artgrid.storage.ObjectStorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Sort;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ArtworkService.
 *
 * Covers upload validation, the initial status chosen from the artist's verification,
 * storage failures, hidden artworks and pagination bounds.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ArtworkService Unit Tests")
class ArtworkServiceTest {

    @Mock
    private ArtworkRepository artworkRepository;

    @Mock
    private ObjectStorageService storageService;

    @Mock
    private AccessPolicy accessPolicy;

    @Mock
    private NotificationService notificationService;

    private ArtworkService artworkService;
    private Authentication authentication;
    private User artist;
    private MockMultipartFile image;

    @BeforeEach
    void setUp() {
        artworkService = new ArtworkService(artworkRepository, storageService, accessPolicy,
                notificationService, new ArtgridProperties());

        authentication = new UsernamePasswordAuthenticationToken("2", null, List.of());
        artist = new User("Artist", "artist@my.uopeople.edu", "h", "d", "S2", "Year 1");
        artist.setId(2L);
        image = new MockMultipartFile("file", "Sunset.PNG", "image/png", new byte[]{1, 2, 3});
    }

    private void stubSave() {
        when(artworkRepository.save(any(Artwork.class))).thenAnswer(invocation -> {
            Artwork saved = invocation.getArgument(0);
            saved.setId(11L);
            return saved;
        });
    }

    @Test
    @DisplayName("upload by an unverified artist should store the file and create a pending artwork")
    void testUpload_Pending() {
        // Arrange
        when(accessPolicy.currentUser(authentication)).thenReturn(artist);
        when(storageService.store(anyString(), eq(image))).thenReturn("https://cdn.example/artworks/x.png");
        stubSave();

        // Act
        ArtworkUploadResponse response = artworkService.upload(authentication, image,
                " Sunset ", null, "Oil Paint", "Painting", "sky,sea", "2024-05-01");

        // Assert
        assertEquals(11L, response.getArtworkId());
        assertEquals("pending", response.getStatus());

        ArgumentCaptor<String> keyCaptor = ArgumentCaptor.forClass(String.class);
        verify(storageService).store(keyCaptor.capture(), eq(image));
        assertTrue(keyCaptor.getValue().startsWith("artworks/"));
        assertTrue(keyCaptor.getValue().endsWith(".png"));

        ArgumentCaptor<Artwork> artworkCaptor = ArgumentCaptor.forClass(Artwork.class);
        InOrder inOrder = inOrder(storageService, artworkRepository, notificationService);
        inOrder.verify(storageService).store(anyString(), eq(image));
        inOrder.verify(artworkRepository).save(artworkCaptor.capture());
        inOrder.verify(notificationService).sendSubmissionReceived(eq(artist), any(Artwork.class));

        Artwork saved = artworkCaptor.getValue();
        assertEquals("Sunset", saved.getTitle());
        assertEquals("", saved.getDescription());
        assertEquals("https://cdn.example/artworks/x.png", saved.getFileUrl());
        assertEquals(LocalDate.of(2024, 5, 1), saved.getCreationDate());
        assertEquals(0, saved.getLikesCount());
        assertEquals(0, saved.getViewsCount());
        assertNull(saved.getApprovalDate());
    }

    @Test
    @DisplayName("upload by a verified artist should be approved immediately")
    void testUpload_VerifiedArtist() {
        // Arrange
        artist.setVerificationStatus(User.VerificationStatus.VERIFIED);
        when(accessPolicy.currentUser(authentication)).thenReturn(artist);
        when(storageService.store(anyString(), eq(image))).thenReturn("/uploads/artworks/x.png");
        stubSave();

        // Act
        ArtworkUploadResponse response = artworkService.upload(authentication, image,
                "Sunset", "", "Oil Paint", "Painting", "", "not-a-date");

        // Assert
        assertEquals("approved", response.getStatus());
        ArgumentCaptor<Artwork> captor = ArgumentCaptor.forClass(Artwork.class);
        verify(artworkRepository).save(captor.capture());
        assertNotNull(captor.getValue().getApprovalDate());
        assertNull(captor.getValue().getCreationDate());
    }

    @Test
    @DisplayName("upload should reject a missing file, a disallowed extension and an empty file")
    void testUpload_InvalidFiles() {
        when(accessPolicy.currentUser(authentication)).thenReturn(artist);

        IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
                () -> artworkService.upload(authentication, null, "T", "", "Pencil", "Drawing", "", null));
        assertEquals("No file uploaded", missing.getMessage());

        MockMultipartFile exe = new MockMultipartFile("file", "virus.exe", "application/octet-stream", new byte[]{1});
        IllegalArgumentException badType = assertThrows(IllegalArgumentException.class,
                () -> artworkService.upload(authentication, exe, "T", "", "Pencil", "Drawing", "", null));
        assertEquals("File type not allowed", badType.getMessage());

        MockMultipartFile empty = new MockMultipartFile("file", "blank.png", "image/png", new byte[0]);
        IllegalArgumentException blank = assertThrows(IllegalArgumentException.class,
                () -> artworkService.upload(authentication, empty, "T", "", "Pencil", "Drawing", "", null));
        assertEquals("Uploaded file is empty", blank.getMessage());

        verifyNoInteractions(storageService, artworkRepository);
    }

    @Test
    @DisplayName("upload should require title, medium and category")
    void testUpload_MissingFields() {
        when(accessPolicy.currentUser(authentication)).thenReturn(artist);

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> artworkService.upload(authentication, image, "Sunset", "", " ", "Painting", "", null));
        assertEquals("Title, medium, and category are required", ex.getMessage());
        verifyNoInteractions(storageService);
    }

    @Test
    @DisplayName("a storage failure should leave no artwork behind")
    void testUpload_StorageFailure() {
        when(accessPolicy.currentUser(authentication)).thenReturn(artist);
        when(storageService.store(anyString(), eq(image)))
                .thenThrow(StorageException.uploadFailed("artworks/x.png", new RuntimeException("bucket gone")));

        assertThrows(StorageException.class, () -> artworkService.upload(authentication, image,
                "Sunset", "", "Oil Paint", "Painting", "", null));
        verifyNoInteractions(artworkRepository, notificationService);
    }

    @Test
    @DisplayName("getArtwork should count the view of an approved artwork")
    void testGetArtwork_Approved() {
        // Arrange
        Artwork artwork = new Artwork(artist, "Sunset", "", "Oil Paint", "Painting", "/uploads/a.png", "", null);
        artwork.setId(11L);
        artwork.approve();
        when(artworkRepository.findById(11L)).thenReturn(Optional.of(artwork));
        when(artworkRepository.findWithArtistById(11L)).thenReturn(Optional.of(artwork));

        // Act
        ArtworkResponse response = artworkService.getArtwork(11L);

        // Assert
        assertEquals(11L, response.getId());
        assertEquals(2L, response.getArtist().getId());
        verify(artworkRepository).incrementViews(11L);
    }

    @Test
    @DisplayName("getArtwork should hide pending artworks without counting a view")
    void testGetArtwork_Pending() {
        Artwork artwork = new Artwork(artist, "Sunset", "", "Oil Paint", "Painting", "/uploads/a.png", "", null);
        artwork.setId(12L);
        when(artworkRepository.findById(12L)).thenReturn(Optional.of(artwork));

        assertThrows(ResourceNotFoundException.class, () -> artworkService.getArtwork(12L));
        verify(artworkRepository, never()).incrementViews(any());
    }

    @Test
    @DisplayName("pageRequest should reject out-of-range values")
    void testPageRequest_Bounds() {
        assertThrows(IllegalArgumentException.class,
                () -> ArtworkService.pageRequest(0, 12, Sort.unsorted()));
        assertThrows(IllegalArgumentException.class,
                () -> ArtworkService.pageRequest(1, 0, Sort.unsorted()));
        assertThrows(IllegalArgumentException.class,
                () -> ArtworkService.pageRequest(1, 101, Sort.unsorted()));
        assertEquals(2, ArtworkService.pageRequest(3, 12, Sort.unsorted()).getPageNumber());
    }
}
