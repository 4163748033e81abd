package com.artgrid.service;

import com.artgrid.dto.response.LikeToggleResponse;
import com.artgrid.entity.Artwork;
import com.artgrid.entity.ArtworkLike;
import com.artgrid.entity.User;
import com.artgrid.exception.ResourceNotFoundException;
import com.artgrid.repository.ArtworkLikeRepository;
import com.artgrid.repository.ArtworkRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("LikeService Unit Tests")
class LikeServiceTest {

    @Mock
    private ArtworkRepository artworkRepository;

    @Mock
    private ArtworkLikeRepository likeRepository;

    @Mock
    private ArtworkService artworkService;

    @Mock
    private AccessPolicy accessPolicy;

    @InjectMocks
    private LikeService likeService;

    private Authentication authentication;
    private User user;
    private Artwork artwork;

    @BeforeEach
    void setUp() {
        authentication = new UsernamePasswordAuthenticationToken("3", null, List.of());
        user = new User("Fan", "fan@my.uopeople.edu", "h", "d", "S3", "Year 4");
        user.setId(3L);
        artwork = new Artwork(user, "Dune", "", "Pencil", "Drawing", "/uploads/d.png", "", null);
        artwork.setId(20L);
        artwork.approve();

        when(accessPolicy.currentUser(authentication)).thenReturn(user);
    }

    @Test
    @DisplayName("first toggle should insert a like and recompute the counter")
    void testToggleLike_Like() {
        // Arrange
        when(artworkService.requireApproved(20L)).thenReturn(artwork);
        when(likeRepository.deleteByUserIdAndArtworkId(3L, 20L)).thenReturn(0);
        when(artworkRepository.findLikesCountById(20L)).thenReturn(1);

        // Act
        LikeToggleResponse response = likeService.toggleLike(authentication, 20L);

        // Assert
        assertTrue(response.isLiked());
        assertEquals(1, response.getLikesCount());
        InOrder inOrder = inOrder(likeRepository, artworkRepository);
        inOrder.verify(likeRepository).saveAndFlush(any(ArtworkLike.class));
        inOrder.verify(artworkRepository).recomputeLikesCount(20L);
        inOrder.verify(artworkRepository).findLikesCountById(20L);
    }

    @Test
    @DisplayName("second toggle should remove the like and recompute the counter")
    void testToggleLike_Unlike() {
        // Arrange
        when(artworkService.requireApproved(20L)).thenReturn(artwork);
        when(likeRepository.deleteByUserIdAndArtworkId(3L, 20L)).thenReturn(1);
        when(artworkRepository.findLikesCountById(20L)).thenReturn(0);

        // Act
        LikeToggleResponse response = likeService.toggleLike(authentication, 20L);

        // Assert
        assertFalse(response.isLiked());
        assertEquals(0, response.getLikesCount());
        verify(likeRepository, never()).saveAndFlush(any());
        verify(artworkRepository).recomputeLikesCount(20L);
    }

    @Test
    @DisplayName("liking a hidden artwork should fail without touching likes")
    void testToggleLike_NotApproved() {
        when(artworkService.requireApproved(20L)).thenThrow(ResourceNotFoundException.artwork(20L));

        assertThrows(ResourceNotFoundException.class, () -> likeService.toggleLike(authentication, 20L));
        verifyNoInteractions(likeRepository, artworkRepository);
    }
}
