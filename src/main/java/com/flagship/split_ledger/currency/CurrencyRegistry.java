package com.flagship.split_ledger.currency;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Canonicalizes currency tokens to ISO codes.
 *
 * Recognizes the ISO codes of the common-currency list (case-insensitive)
 * plus a fixed table of symbols, slang and native-script names. The tables
 * are immutable, so the registry is safe to share between threads.
 */
@Component
public class CurrencyRegistry {

    private static final Set<String> COMMON_CODES = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(
        "USD", "EUR", "GBP", "ILS", "JPY", "CHF", "CAD", "AUD", "NZD", "SEK", "NOK", "DKK", "ZAR",
        "PLN", "TRY", "MXN", "BRL", "INR", "RUB", "CNY", "HKD", "SGD", "AED", "SAR", "EGP"
    )));

    // Keys are lowercase; lookups lowercase the token first.
    private static final Map<String, String> ALIASES = Map.ofEntries(
        // Shekel: symbol, transliterations and Hebrew forms (with and without gershayim)
        entry("₪", "ILS"),
        entry("nis", "ILS"),
        entry("n.i.s", "ILS"),
        entry("שח", "ILS"),
        entry("ש״ח", "ILS"),
        entry("ש\"ח", "ILS"),
        entry("שקל", "ILS"),
        entry("שקלים", "ILS"),
        entry("שקל חדש", "ILS"),
        // Dollar
        entry("$", "USD"),
        entry("usd$", "USD"),
        entry("דולר", "USD"),
        entry("דולרים", "USD"),
        entry("דולר אמריקאי", "USD"),
        // Euro
        entry("€", "EUR"),
        entry("יורו", "EUR"),
        entry("אירו", "EUR"),
        // Pound
        entry("£", "GBP"),
        entry("פאונד", "GBP"),
        entry("לירה", "GBP"),
        entry("לירה שטרלינג", "GBP"),
        // Others
        entry("fr", "CHF"),
        entry("yen", "JPY"),
        entry("rs", "INR"),
        entry("₹", "INR"),
        entry("רופי", "INR"),
        entry("רופי הודי", "INR"),
        entry("real", "BRL"),
        entry("ריאל", "BRL"),
        entry("peso", "MXN"),
        entry("פסו", "MXN"),
        entry("rand", "ZAR"),
        entry("руб", "RUB"),
        entry("rmb", "CNY"),
        entry("元", "CNY"),
        entry("יואן", "CNY"),
        entry("درهم", "AED"),
        entry("דירהם", "AED"),
        entry("ريال", "SAR"),
        entry("ריאל סעודי", "SAR"),
        entry("לירה טורקית", "TRY")
    );

    /**
     * Normalizes a currency token.
     *
     * @param token ISO code, symbol or alias; surrounding whitespace and trailing punctuation are ignored
     * @return the canonical code, or empty if the token is not recognized
     */
    public Optional<CurrencyCode> normalize(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String cleaned = stripTrailingPunctuation(token.strip());
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }

        String upper = cleaned.toUpperCase(Locale.ROOT);
        if (COMMON_CODES.contains(upper)) {
            return Optional.of(CurrencyCode.of(upper));
        }

        String alias = ALIASES.get(cleaned.toLowerCase(Locale.ROOT));
        return Optional.ofNullable(alias).map(CurrencyCode::of);
    }

    /**
     * Checks whether a code belongs to the recognized currency list.
     */
    public boolean isSupported(CurrencyCode code) {
        return code != null && COMMON_CODES.contains(code.getCode());
    }

    /**
     * Returns the recognized ISO codes in display order.
     */
    public Set<String> supportedCodes() {
        return COMMON_CODES;
    }

    private static String stripTrailingPunctuation(String value) {
        int end = value.length();
        while (end > 0 && ".,?!".indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        // "n.i.s." must keep its inner dots
        return value.substring(0, end);
    }
}
