package com.flagship.split_ledger.currency;

import lombok.Value;

import java.util.regex.Pattern;

/**
 * ISO-4217-like currency identity: exactly three uppercase letters.
 *
 * Unlike a closed enum this accepts any well-formed code, so a ledger can
 * hold currencies the alias table does not know about. Whether a code is
 * one the service actively recognizes is a question for {@link CurrencyRegistry}.
 */
@Value
public class CurrencyCode implements Comparable<CurrencyCode> {

    private static final Pattern ISO_PATTERN = Pattern.compile("^[A-Z]{3}$");

    public static final CurrencyCode USD = new CurrencyCode("USD");

    String code;

    private CurrencyCode(String code) {
        this.code = code;
    }

    /**
     * Creates a currency code from its canonical form.
     *
     * @throws IllegalArgumentException if the value is not three uppercase letters
     */
    public static CurrencyCode of(String code) {
        if (code == null || !ISO_PATTERN.matcher(code).matches()) {
            throw new IllegalArgumentException("Currency must be a 3-letter ISO code: " + code);
        }
        return new CurrencyCode(code);
    }

    @Override
    public int compareTo(CurrencyCode other) {
        return code.compareTo(other.code);
    }

    @Override
    public String toString() {
        return code;
    }
}
