package com.civicintake.authservice.api;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /api/auth/signup}.
 *
 * @param role requested role name; absent means USER
 */
public record SignupRequest(
        @NotBlank @Size(min = 2, max = 100, message = "Name must be between 2 and 100 characters") String name,
        @NotBlank @Email(message = "Invalid email format") String email,
        @NotBlank @Size(min = 8, max = 128, message = "Password must be between 8 and 128 characters")
                String password,
        @Pattern(regexp = "^\\+?[1-9]\\d{1,14}$", message = "Invalid phone number format") String phone,
        String role) {

    @Override
    public String toString() {
        return "SignupRequest[name=%s, email=%s, role=%s]".formatted(name, email, role);
    }
}
