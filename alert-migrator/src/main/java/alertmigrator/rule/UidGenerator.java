package alertmigrator.rule;

import java.security.SecureRandom;

/**
 * Generates UIDs for synthesized rules and folders.
 */
@FunctionalInterface
public interface UidGenerator {

    String next();

    /**
     * Returns a generator of random 9 character alphanumeric UIDs.
     */
    static UidGenerator shortUids() {
        return ShortUids.INSTANCE;
    }

    /** Default generator; instances are thread-safe. */
    enum ShortUids implements UidGenerator {
        INSTANCE;

        private static final char[] ALPHABET =
                "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();
        private static final int LENGTH = 9;
        private final SecureRandom random = new SecureRandom();

        @Override
        public String next() {
            char[] uid = new char[LENGTH];
            for (int i = 0; i < LENGTH; i++) {
                uid[i] = ALPHABET[random.nextInt(ALPHABET.length)];
            }
            return new String(uid);
        }
    }
}
