package com.thetaguard.correlation;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reduces broker symbols to the root used in the correlation table: {@code /ESZ4 -> ES},
 * {@code mes -> MES}, {@code /6EH25 -> 6E}.
 */
final class SymbolNormalizer {

    // Futures month code followed by a 1 or 2 digit year.
    private static final Pattern CONTRACT_SUFFIX = Pattern.compile("^([A-Z0-9]+?)[FGHJKMNQUVXZ]\\d{1,2}$");

    private SymbolNormalizer() {}

    static String clean(String symbol) {
        String cleaned = symbol.trim().toUpperCase(Locale.ROOT);
        return cleaned.startsWith("/") ? cleaned.substring(1) : cleaned;
    }

    /** The cleaned symbol if it is a known root, else the contract-stripped root if that is known, else the cleaned symbol. */
    static String root(String symbol, Set<String> knownRoots) {
        String cleaned = clean(symbol);
        if (knownRoots.contains(cleaned)) {
            return cleaned;
        }
        Matcher matcher = CONTRACT_SUFFIX.matcher(cleaned);
        if (matcher.matches() && knownRoots.contains(matcher.group(1))) {
            return matcher.group(1);
        }
        return cleaned;
    }
}
