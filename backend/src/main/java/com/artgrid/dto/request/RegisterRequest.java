package com.artgrid.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for account registration.
 *
 * Example JSON request:
 * <pre>
 * {
 *   "full_name": "Ada Lovelace",
 *   "email": "ada@my.uopeople.edu",
 *   "password": "s3cret!",
 *   "dob": "2001-12-10",
 *   "student_id": "S1001",
 *   "year_of_study": "Year 2"
 * }
 * </pre>
 *
 * The institutional email pattern and the uniqueness of email and student ID are
 * checked by {@link com.artgrid.service.AuthService}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRequest {

    @NotBlank(message = "full_name is required")
    private String fullName;

    @NotBlank(message = "email is required")
    private String email;

    @NotBlank(message = "password is required")
    private String password;

    /**
     * Date of birth. Only a salted hash is stored.
     */
    @NotBlank(message = "dob is required")
    private String dob;

    @NotBlank(message = "student_id is required")
    private String studentId;

    @NotBlank(message = "year_of_study is required")
    private String yearOfStudy;
}
