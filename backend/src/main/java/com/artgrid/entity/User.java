package com.artgrid.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * User entity for the art community.
 *
 * Represents a registered student, moderator or administrator. Email and student ID
 * are unique; the database indexes are the source of truth for that rule, the
 * service-level existence checks only give friendlier error messages.
 *
 * Database Table: users
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_user_email", columnList = "email", unique = true),
    @Index(name = "idx_user_student_id", columnList = "student_id", unique = true)
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "full_name", nullable = false, length = 100)
    private String fullName;

    /**
     * Institutional email address. Used as the login name.
     */
    @Column(name = "email", nullable = false, unique = true, length = 120)
    private String email;

    /**
     * Salted BCrypt hash of the password. The plaintext is never stored.
     */
    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    /**
     * Salted hash of the date of birth, kept for identity checks only.
     */
    @Column(name = "dob_hash", nullable = false, length = 255)
    private String dobHash;

    @Column(name = "student_id", nullable = false, unique = true, length = 50)
    private String studentId;

    @Column(name = "year_of_study", nullable = false, length = 20)
    private String yearOfStudy;

    @Column(name = "profile_image_url", length = 255)
    private String profileImageUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_status", nullable = false, length = 20)
    private VerificationStatus verificationStatus = VerificationStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private Role role = Role.STUDENT;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public User(String fullName, String email, String passwordHash, String dobHash,
                String studentId, String yearOfStudy) {
        this.fullName = fullName;
        this.email = email;
        this.passwordHash = passwordHash;
        this.dobHash = dobHash;
        this.studentId = studentId;
        this.yearOfStudy = yearOfStudy;
        this.verificationStatus = VerificationStatus.PENDING;
        this.role = Role.STUDENT;
    }

    public boolean isVerified() {
        return verificationStatus == VerificationStatus.VERIFIED;
    }

    /**
     * Moderators and administrators may review artworks and read statistics.
     */
    public boolean canModerate() {
        return role == Role.MODERATOR || role == Role.ADMIN;
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public enum Role {
        STUDENT,
        MODERATOR,
        ADMIN;

        public String getValue() {
            return name().toLowerCase();
        }
    }

    public enum VerificationStatus {
        PENDING,
        VERIFIED;

        public String getValue() {
            return name().toLowerCase();
        }
    }
}
