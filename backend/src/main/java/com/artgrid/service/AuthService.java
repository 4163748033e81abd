package com.artgrid.service;

import com.artgrid.config.ArtgridProperties;
import com.artgrid.dto.request.LoginRequest;
import com.artgrid.dto.request.ProfileUpdateRequest;
import com.artgrid.dto.request.RegisterRequest;
import com.artgrid.dto.response.AuthResponse;
import com.artgrid.dto.response.UserProfileResponse;
import com.artgrid.entity.User;
import com.artgrid.repository.UserRepository;
import com.artgrid.security.JwtTokenProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.Authentication;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Service for registration, password login and the caller's own profile.
 *
 * Registration flow:
 * 1. Normalize the email (trim, lowercase) and match it against the institutional pattern
 * 2. Reject duplicate email or student ID
 * 3. Hash password and date of birth with BCrypt
 * 4. Persist the user as an unverified student
 * 5. Send a welcome email
 *
 * Login verifies the password hash and issues a JWT carrying the user ID, email and
 * role.
 *
 * @see com.artgrid.security.JwtTokenProvider
 */
@Service
@Slf4j
public class AuthService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;
    private final AccessPolicy accessPolicy;
    private final NotificationService notificationService;
    private final Pattern emailPattern;
    private final String emailHint;

    public AuthService(UserRepository userRepository,
                       PasswordEncoder passwordEncoder,
                       JwtTokenProvider jwtTokenProvider,
                       AccessPolicy accessPolicy,
                       NotificationService notificationService,
                       ArtgridProperties properties) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenProvider = jwtTokenProvider;
        this.accessPolicy = accessPolicy;
        this.notificationService = notificationService;
        this.emailPattern = Pattern.compile(properties.getRegistration().getEmailPattern());
        this.emailHint = properties.getRegistration().getEmailHint();
    }

    /**
     * Register a new student account.
     *
     * The existence checks give precise messages; the unique indexes still decide
     * when two registrations race, and the loser gets the same 400.
     *
     * @param request the registration data
     * @return the persisted user
     * @throws IllegalArgumentException if the email is not institutional or already taken,
     *                                  or the student ID is already taken
     */
    @Transactional
    public User register(RegisterRequest request) {
        String email = normalizeEmail(request.getEmail());
        String studentId = request.getStudentId().trim();
        log.info("Registration requested for email: {}", email);

        if (!emailPattern.matcher(email).matches()) {
            log.warn("Registration rejected, non-institutional email: {}", email);
            throw new IllegalArgumentException(emailHint);
        }
        if (userRepository.existsByEmail(email)) {
            log.warn("Registration rejected, email already registered: {}", email);
            throw new IllegalArgumentException("Email already registered");
        }
        if (userRepository.existsByStudentId(studentId)) {
            log.warn("Registration rejected, student ID already registered: {}", studentId);
            throw new IllegalArgumentException("Student ID already registered");
        }

        User user = new User(
                request.getFullName().trim(),
                email,
                passwordEncoder.encode(request.getPassword()),
                passwordEncoder.encode(request.getDob().trim()),
                studentId,
                request.getYearOfStudy().trim()
        );

        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            log.warn("Registration lost a uniqueness race for email: {}", email);
            throw new IllegalArgumentException("Email or student ID already registered");
        }

        log.info("User registered: id={}, email={}", user.getId(), email);
        notificationService.sendWelcome(user);
        return user;
    }

    /**
     * Verify credentials and issue a token.
     *
     * @param request email and password
     * @return access token and user summary
     * @throws BadCredentialsException if the email is unknown or the password does not match
     */
    @Transactional(readOnly = true)
    public AuthResponse login(LoginRequest request) {
        String email = normalizeEmail(request.getEmail());

        User user = userRepository.findByEmail(email)
                .filter(candidate -> passwordEncoder.matches(request.getPassword(), candidate.getPasswordHash()))
                .orElseThrow(() -> {
                    log.warn("Login failed for email: {}", email);
                    return new BadCredentialsException("Invalid credentials");
                });

        String token = jwtTokenProvider.generateToken(user);
        log.info("Login successful: id={}, role={}", user.getId(), user.getRole());

        return AuthResponse.builder()
                .accessToken(token)
                .user(AuthResponse.AuthenticatedUser.from(user))
                .build();
    }

    @Transactional(readOnly = true)
    public UserProfileResponse getProfile(Authentication authentication) {
        return UserProfileResponse.from(accessPolicy.currentUser(authentication));
    }

    /**
     * Update the caller's display name and year of study. Blank values are ignored.
     */
    @Transactional
    public void updateProfile(Authentication authentication, ProfileUpdateRequest request) {
        User user = accessPolicy.currentUser(authentication);

        if (StringUtils.hasText(request.getFullName())) {
            user.setFullName(request.getFullName().trim());
        }
        if (StringUtils.hasText(request.getYearOfStudy())) {
            user.setYearOfStudy(request.getYearOfStudy().trim());
        }

        userRepository.save(user);
        log.info("Profile updated: id={}", user.getId());
    }

    private String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
