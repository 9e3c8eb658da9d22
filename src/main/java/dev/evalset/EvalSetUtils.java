package dev.evalset;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

public class EvalSetUtils {
    private EvalSetUtils() {}

    public static List<String> parseCsv(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }

        return Arrays.stream(csv.trim().split("\\s*,\\s*")).filter(s -> !s.isEmpty()).toList();
    }

    /**
     * Reduce an arbitrary string to a file-name friendly slug. Lowercases and replaces every run
     * of characters outside {@code [a-z0-9._]} with a single dash.
     */
    public static String slug(String value) {
        var slug =
                value.toLowerCase(Locale.ROOT)
                        .replaceAll("[^a-z0-9._]+", "-")
                        .replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? "_" : slug;
    }

    /** hex encoded sha-256 of the utf-8 bytes of the input, truncated to {@code numBytes} */
    public static String sha256Hex(String value, int numBytes) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            var hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, Math.min(numBytes, hash.length));
        } catch (NoSuchAlgorithmException e) {
            // every jvm is required to ship sha-256
            throw new IllegalStateException(e);
        }
    }
}
