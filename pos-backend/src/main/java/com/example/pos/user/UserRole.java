package com.example.pos.user;

import com.example.pos.exception.InvalidUserException;

public enum UserRole {
    ADMIN,
    CASHIER;

    public static UserRole parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidUserException("Role is required");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidUserException("Role must be ADMIN or CASHIER");
        }
    }
}
