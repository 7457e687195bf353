package com.signalrelay.backend.util;

public final class SecretMasker {

    private SecretMasker() {
    }

    /**
     * {@code abcdefghijkl} becomes {@code abcd...ijkl}; short values are fully hidden, blanks become null.
     */
    public static String mask(String secret) {
        if (secret == null || secret.isBlank()) {
            return null;
        }
        if (secret.length() <= 8) {
            return "***";
        }
        return secret.substring(0, 4) + "..." + secret.substring(secret.length() - 4);
    }
}
