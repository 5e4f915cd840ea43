package com.civicintake.authservice.api;

import jakarta.validation.constraints.NotBlank;

/** Body of {@code PUT /api/users/{id}/role}. */
public record RoleChangeRequest(@NotBlank(message = "Role is required") String role) {}
