package com.artgrid.controller;

import com.artgrid.dto.response.GalleryResponse;
import com.artgrid.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserGalleryController {

    private final UserService userService;

    @GetMapping("/{id}/gallery")
    public ResponseEntity<GalleryResponse> gallery(@PathVariable Long id) {
        return ResponseEntity.ok(userService.gallery(id));
    }
}
