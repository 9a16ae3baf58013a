package hu.advjava.zksudoku;

import java.util.function.UnaryOperator;

/**
 * Run settings. Each key is looked up as a system property first
 * ({@code zksudoku.rounds}, {@code zksudoku.threads}), then as an environment variable
 * ({@code ZK_ROUNDS}, {@code ZK_THREADS}).
 */
public record ProtocolConfig(int rounds, int threads) {
    public static final int DEFAULT_THREADS = 1;

    public static ProtocolConfig load() {
        return from(key -> {
            String value = System.getProperty("zksudoku." + key);
            return value != null ? value : System.getenv("ZK_" + key.toUpperCase());
        });
    }

    /** Reads the settings through {@code lookup}, which maps "rounds" / "threads" to a raw value or null. */
    public static ProtocolConfig from(UnaryOperator<String> lookup) {
        return new ProtocolConfig(
                positive(lookup, "rounds", Protocol.DEFAULT_ROUNDS),
                positive(lookup, "threads", DEFAULT_THREADS));
    }

    private static int positive(UnaryOperator<String> lookup, String key, int fallback) {
        String raw = lookup.apply(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 1) throw new IllegalStateException("Set " + key + " to a positive number, got " + value);
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Set " + key + " to a positive number, got '" + raw + "'", e);
        }
    }
}
