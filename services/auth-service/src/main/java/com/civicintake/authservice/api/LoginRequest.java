package com.civicintake.authservice.api;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/** Body of {@code POST /api/auth/login}. */
public record LoginRequest(
        @NotBlank @Email(message = "Invalid email format") String email,
        @NotBlank(message = "Password is required") String password) {

    @Override
    public String toString() {
        return "LoginRequest[email=" + email + "]";
    }
}
