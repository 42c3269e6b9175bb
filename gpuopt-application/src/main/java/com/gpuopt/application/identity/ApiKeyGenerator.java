package com.gpuopt.application.identity;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Customer API keys: {@code gopt_} followed by 23 url-safe base64 characters.
 */
public class ApiKeyGenerator {

    public static final String PREFIX = "gopt_";
    public static final int BODY_LENGTH = 23;

    private static final Pattern FORMAT = Pattern.compile("^gopt_[A-Za-z0-9_-]{23}$");
    private static final int RANDOM_BYTES = 18;

    private final SecureRandom random;

    public ApiKeyGenerator() {
        this(new SecureRandom());
    }

    public ApiKeyGenerator(SecureRandom random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public String generate() {
        byte[] bytes = new byte[RANDOM_BYTES];
        random.nextBytes(bytes);
        String body = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        return PREFIX + body.substring(0, BODY_LENGTH);
    }

    public static boolean isWellFormed(String key) {
        return key != null && FORMAT.matcher(key).matches();
    }

    /** Safe form for logs: prefix plus the first four characters. */
    public static String mask(String key) {
        if (key == null || key.isEmpty()) return "<none>";
        int keep = Math.min(key.length(), PREFIX.length() + 4);
        return key.substring(0, keep) + "***";
    }
}
