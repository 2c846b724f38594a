package com.libragraph.keeper.util;

import java.text.Normalizer;
import java.util.Objects;

/**
 * Normalises strings into POSIX-safe environment variable keys.
 *
 * <p>Keys consist only of {@code [A-Z0-9_]}: accented characters are folded to their
 * base letter, everything else that is not an ASCII letter or digit becomes a single
 * underscore, and leading/trailing underscores are trimmed.
 * Example: {@code "my-Énv.key"} becomes {@code "MY_ENV_KEY"}.
 */
public final class EnvKeys {

    private EnvKeys() {
    }

    public static String normalize(String name) {
        Objects.requireNonNull(name, "name cannot be null");

        // NFD splits é into e + combining acute; the marks are dropped below
        String decomposed = Normalizer.normalize(name, Normalizer.Form.NFD);

        StringBuilder out = new StringBuilder(decomposed.length());
        for (int i = 0; i < decomposed.length(); ) {
            int cp = decomposed.codePointAt(i);
            i += Character.charCount(cp);

            if (Character.getType(cp) == Character.NON_SPACING_MARK) {
                continue;
            }
            if ((cp >= 'A' && cp <= 'Z') || (cp >= 'a' && cp <= 'z') || (cp >= '0' && cp <= '9')) {
                out.append(Character.toUpperCase((char) cp));
            } else if (out.length() == 0 || out.charAt(out.length() - 1) != '_') {
                out.append('_');
            }
        }

        int start = 0;
        int end = out.length();
        while (start < end && out.charAt(start) == '_') {
            start++;
        }
        while (end > start && out.charAt(end - 1) == '_') {
            end--;
        }
        return out.substring(start, end);
    }

    /**
     * Normalises a raw prefix and terminates it with one underscore, so that
     * {@code prefix + "GRACE_COUNT"} is a well-formed key. An empty prefix stays empty.
     */
    public static String prefix(String rawPrefix) {
        String normalized = normalize(rawPrefix);
        return normalized.isEmpty() ? "" : normalized + "_";
    }

    /**
     * Derives the default prefix {@code <namespace>_<name>_}; the namespace part is
     * omitted when empty.
     */
    public static String defaultPrefix(String namespace, String name) {
        String raw = (namespace == null || namespace.isEmpty()) ? "" : namespace + "_";
        return prefix(raw + (name == null ? "" : name) + "_");
    }
}
