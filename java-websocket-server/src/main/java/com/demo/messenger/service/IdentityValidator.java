package com.demo.messenger.service;

import com.demo.messenger.domain.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Username rules: 1 to 50 characters after trimming, letters, digits and underscores only.
 */
@Component
public class IdentityValidator {

    public static final int MAX_LENGTH = 50;

    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9_]+");

    public ValidationResult validate(String rawUsername) {
        String username = rawUsername == null ? "" : rawUsername.trim();

        if (username.isEmpty() || username.length() > MAX_LENGTH) {
            return ValidationResult.failure("Username must be between 1 and " + MAX_LENGTH + " characters");
        }
        if (!ALLOWED.matcher(username).matches()) {
            return ValidationResult.failure("Username can only contain letters, numbers, and underscores");
        }
        return ValidationResult.success(username);
    }
}
