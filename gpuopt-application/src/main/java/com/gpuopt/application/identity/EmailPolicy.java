package com.gpuopt.application.identity;

import com.gpuopt.domain.ValidationException;

import java.util.regex.Pattern;

/**
 * Signup email rules: plain syntax check plus rejection of characters and shapes
 * that only show up in injection attempts.
 */
public final class EmailPolicy {

    public static final int MAX_LENGTH = 255;

    private static final Pattern SYNTAX =
            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    private static final Pattern SUSPICIOUS_CHARS = Pattern.compile("[<>\"';\\\\\\p{Cntrl}]");

    /**
     * @throws ValidationException with a client-safe message
     */
    public void validate(String email) {
        if (email == null || email.isBlank()) {
            throw new ValidationException("Email is required");
        }
        if (email.length() > MAX_LENGTH) {
            throw new ValidationException("Email must be at most " + MAX_LENGTH + " characters");
        }
        if (SUSPICIOUS_CHARS.matcher(email).find()) {
            throw new SuspiciousEmailException("Email contains forbidden characters");
        }
        if (email.contains("..")) {
            throw new SuspiciousEmailException("Email contains consecutive dots");
        }
        if (email.startsWith(".") || email.endsWith(".")) {
            throw new SuspiciousEmailException("Email starts or ends with a dot");
        }
        if (!SYNTAX.matcher(email).matches()) {
            throw new ValidationException("Invalid email address");
        }
    }

    public boolean isValid(String email) {
        try {
            validate(email);
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }

    /** Validation failure that is also worth a security log line. */
    static final class SuspiciousEmailException extends ValidationException {
        SuspiciousEmailException(String message) {
            super(message);
        }
    }
}
