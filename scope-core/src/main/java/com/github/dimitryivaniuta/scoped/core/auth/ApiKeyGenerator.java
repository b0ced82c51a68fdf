package com.github.dimitryivaniuta.scoped.core.auth;

import java.security.SecureRandom;
import java.util.Optional;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Issues API keys of the form {@code <prefix>.<secret>}.
 *
 * <p>The prefix is stored in clear for lookup; the full key is hashed with the configured
 * {@link PasswordEncoder}.</p>
 */
public final class ApiKeyGenerator {

    public static final int PREFIX_LENGTH = 8;

    public static final int SECRET_LENGTH = 32;

    public static final char KEY_SEPARATOR = '.';

    private static final char[] ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

    private final PasswordEncoder passwordEncoder;

    private final SecureRandom random;

    public ApiKeyGenerator(final PasswordEncoder passwordEncoder) {
        this(passwordEncoder, new SecureRandom());
    }

    public ApiKeyGenerator(final PasswordEncoder passwordEncoder, final SecureRandom random) {
        this.passwordEncoder = passwordEncoder;
        this.random = random;
    }

    public GeneratedApiKey generate() {
        String prefix = randomString(PREFIX_LENGTH);
        String rawKey = prefix + KEY_SEPARATOR + randomString(SECRET_LENGTH);
        return new GeneratedApiKey(prefix, rawKey, passwordEncoder.encode(rawKey));
    }

    /**
     * Extracts the lookup prefix of a raw key.
     *
     * @param rawKey presented key
     * @return prefix, or empty when the key is not of the form {@code prefix.secret}
     */
    public static Optional<String> prefixOf(final String rawKey) {
        if (rawKey == null) return Optional.empty();
        int i = rawKey.indexOf(KEY_SEPARATOR);
        if (i <= 0 || i == rawKey.length() - 1) return Optional.empty();
        return Optional.of(rawKey.substring(0, i));
    }

    private String randomString(final int length) {
        char[] out = new char[length];
        for (int i = 0; i < length; i++) {
            out[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new String(out);
    }
}
