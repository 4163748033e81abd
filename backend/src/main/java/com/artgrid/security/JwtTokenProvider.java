package com.artgrid.security;

import com.artgrid.config.ArtgridProperties;
import com.artgrid.entity.User;
import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Date;

/**
 * JWT Token Provider for generating and validating bearer tokens.
 *
 * Tokens carry the user ID as subject plus the email and role claims and are signed
 * with HS256. The role claim is informational: privileged handlers re-read the role
 * from the database through {@link com.artgrid.service.AccessPolicy}.
 *
 * @see io.jsonwebtoken.Jwts
 */
@Component
@Slf4j
public class JwtTokenProvider {

    static final String EMAIL_CLAIM = "email";
    static final String ROLE_CLAIM = "role";

    private final SecretKey secretKey;
    private final long jwtExpirationMs;

    public JwtTokenProvider(ArtgridProperties properties) {
        String secret = properties.getJwt().getSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < 32) {
            throw new IllegalStateException("artgrid.jwt.secret must be set and at least 32 bytes long");
        }
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.jwtExpirationMs = properties.getJwt().getExpiration();
        log.info("JWT Token Provider initialized with expiration: {} ms", jwtExpirationMs);
    }

    /**
     * Generate a token for an authenticated user.
     *
     * Claims:
     * - sub: user ID
     * - email: user email address
     * - role: student, moderator or admin
     * - iat / exp: issue and expiry timestamps
     *
     * @param user the authenticated user
     * @return signed JWT string
     */
    public String generateToken(User user) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + jwtExpirationMs);

        String token = Jwts.builder()
                .subject(String.valueOf(user.getId()))
                .claim(EMAIL_CLAIM, user.getEmail())
                .claim(ROLE_CLAIM, user.getRole().getValue())
                .issuedAt(now)
                .expiration(expiryDate)
                .signWith(secretKey, Jwts.SIG.HS256)
                .compact();

        log.debug("Generated JWT token for user: {} (email: {})", user.getId(), user.getEmail());
        return token;
    }

    /**
     * Validate token signature, expiration and structure.
     *
     * @param token the JWT token to validate
     * @return true if token is valid, false otherwise
     */
    public boolean validateToken(String token) {
        try {
            parseClaims(token);
            return true;
        } catch (ExpiredJwtException ex) {
            log.warn("Expired JWT token: {}", ex.getMessage());
        } catch (io.jsonwebtoken.security.SecurityException ex) {
            log.warn("Invalid JWT signature: {}", ex.getMessage());
        } catch (MalformedJwtException ex) {
            log.warn("Invalid JWT token: {}", ex.getMessage());
        } catch (UnsupportedJwtException ex) {
            log.warn("Unsupported JWT token: {}", ex.getMessage());
        } catch (IllegalArgumentException ex) {
            log.warn("JWT claims string is empty: {}", ex.getMessage());
        }
        return false;
    }

    public Long getUserIdFromToken(String token) {
        return Long.valueOf(parseClaims(token).getSubject());
    }

    /**
     * Build the Spring Security authentication for a validated token.
     *
     * The principal is the user ID as a string, the details hold the email and the
     * single authority is {@code ROLE_<ROLE>}.
     *
     * @param token the JWT token
     * @return Authentication object with user details
     */
    public Authentication getAuthentication(String token) {
        Claims claims = parseClaims(token);
        String role = claims.get(ROLE_CLAIM, String.class);

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(
                        claims.getSubject(),
                        null,
                        Collections.singletonList(new SimpleGrantedAuthority(
                                "ROLE_" + (role != null ? role.toUpperCase() : "STUDENT")))
                );

        authentication.setDetails(claims.get(EMAIL_CLAIM, String.class));
        return authentication;
    }

    /**
     * Extract the token from an Authorization header of the form "Bearer {token}".
     *
     * @param bearerToken the Authorization header value
     * @return the JWT token string, or null if header is invalid
     */
    public String extractTokenFromHeader(String bearerToken) {
        if (bearerToken != null && bearerToken.startsWith("Bearer ")) {
            return bearerToken.substring(7);
        }
        return null;
    }

    private Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
