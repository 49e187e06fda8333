package io.contextrunr.alias;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed name query.
 *
 * @param normalized      lower-cased, whitespace-normalized query without a leading {@code @}
 * @param tokens          query words longer than two characters, honorific excluded
 * @param honorificTarget word following a leading honorific ({@code pak budi} gives {@code budi}), or null
 * @param phoneDigits     first run of ten or more digits, or null
 */
public record AliasQuery(String normalized, List<String> tokens, String honorificTarget, String phoneDigits) {

    private static final Pattern HONORIFIC = Pattern.compile("^(si|pak|bu|mas|mbak|bang|kak)\\s+(\\S+)");
    private static final Pattern PHONE = Pattern.compile("\\d{10,}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public AliasQuery {
        tokens = List.copyOf(tokens);
    }

    public static AliasQuery parse(String nameQuery) {
        String normalized = normalize(nameQuery);

        String honorificWord = null;
        String honorificTarget = null;
        Matcher honorific = HONORIFIC.matcher(normalized);
        if (honorific.find()) {
            honorificWord = honorific.group(1);
            honorificTarget = honorific.group(2);
        }

        List<String> tokens = new ArrayList<>();
        boolean skippedHonorific = false;
        for (String token : tokens(normalized)) {
            if (!skippedHonorific && token.equals(honorificWord)) {
                skippedHonorific = true;
                continue;
            }
            if (token.length() > 2) {
                tokens.add(token);
            }
        }

        Matcher phone = PHONE.matcher(normalized);
        String phoneDigits = phone.find() ? phone.group() : null;

        return new AliasQuery(normalized, tokens, honorificTarget, phoneDigits);
    }

    public boolean isEmpty() {
        return normalized.isEmpty();
    }

    /** Lower-cases, strips a leading {@code @} and collapses whitespace. Null gives an empty string. */
    public static String normalize(String value) {
        if (value == null) return "";
        String lower = WHITESPACE.matcher(value.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
        while (lower.startsWith("@")) {
            lower = lower.substring(1).trim();
        }
        return lower;
    }

    static List<String> tokens(String normalized) {
        if (normalized.isEmpty()) return List.of();
        return List.of(normalized.split(" "));
    }
}
