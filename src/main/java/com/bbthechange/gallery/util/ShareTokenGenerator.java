package com.bbthechange.gallery.util;

import java.security.SecureRandom;
import java.util.function.Predicate;

/**
 * Generates share tokens for public event links.
 */
public class ShareTokenGenerator {

    private static final String CHARACTERS = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int TOKEN_LENGTH = 16;
    private static final SecureRandom random = new SecureRandom();

    /**
     * Format: 16 characters, lowercase alphanumeric.
     */
    public static String generate() {
        StringBuilder token = new StringBuilder(TOKEN_LENGTH);
        for (int i = 0; i < TOKEN_LENGTH; i++) {
            token.append(CHARACTERS.charAt(random.nextInt(CHARACTERS.length())));
        }
        return token.toString();
    }

    /**
     * Generate tokens until one is not taken.
     * With 36^16 possible tokens a second round is practically never needed.
     *
     * @param existsChecker returns true if a token is already in use
     */
    public static String generateUnique(Predicate<String> existsChecker) {
        String token;
        do {
            token = generate();
        } while (existsChecker.test(token));
        return token;
    }
}
