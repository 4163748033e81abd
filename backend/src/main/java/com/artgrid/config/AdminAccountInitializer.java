package com.artgrid.config;

import com.artgrid.entity.User;
import com.artgrid.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Creates the administrator account on startup when it does not exist yet.
 *
 * Skipped when {@code artgrid.admin.password} is empty, so no account with a known
 * default password is ever created implicitly.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminAccountInitializer implements ApplicationRunner {

    static final String PLACEHOLDER_DOB = "1990-01-01";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final ArtgridProperties properties;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        ArtgridProperties.Admin admin = properties.getAdmin();
        if (!StringUtils.hasText(admin.getPassword())) {
            log.warn("artgrid.admin.password is not set; skipping admin account creation");
            return;
        }

        String email = admin.getEmail().trim().toLowerCase(Locale.ROOT);
        if (userRepository.existsByEmail(email)) {
            log.debug("Admin account already present: {}", email);
            return;
        }

        User user = new User(
                admin.getFullName(),
                email,
                passwordEncoder.encode(admin.getPassword()),
                passwordEncoder.encode(PLACEHOLDER_DOB),
                admin.getStudentId(),
                "Graduate"
        );
        user.setRole(User.Role.ADMIN);
        user.setVerificationStatus(User.VerificationStatus.VERIFIED);
        userRepository.save(user);

        log.info("Admin account created: {}", email);
    }
}
