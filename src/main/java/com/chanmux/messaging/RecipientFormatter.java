package com.chanmux.messaging;

import java.util.regex.Pattern;

/**
 * Normalizes phone numbers to account JIDs, {@code [country code][number]@s.whatsapp.net}.
 */
public class RecipientFormatter {

    static final String USER_SUFFIX = "@s.whatsapp.net";
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");

    private final String defaultCountryCode;

    public RecipientFormatter(String defaultCountryCode) {
        this.defaultCountryCode = defaultCountryCode != null ? defaultCountryCode : "";
    }

    public String toJid(String number) {
        var digits = digits(number);
        if (!digits.startsWith(defaultCountryCode)) {
            digits = defaultCountryCode + digits;
        }
        return digits + USER_SUFFIX;
    }

    /** 10 to 15 digits once punctuation and spaces are stripped. */
    public boolean isValid(String number) {
        if (number == null) return false;
        int length = digits(number).length();
        return length >= 10 && length <= 15;
    }

    private static String digits(String number) {
        return number == null ? "" : NON_DIGITS.matcher(number).replaceAll("");
    }
}
