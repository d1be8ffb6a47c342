package com.takeaway.storefront.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class UkPostcodeUtils {

    private static final Pattern UK_POSTCODE =
            Pattern.compile("^(GIR 0AA|[A-Z]{1,2}\\d{1,2}[A-Z]?\\s?\\d[A-Z]{2})$", Pattern.CASE_INSENSITIVE);

    private UkPostcodeUtils() {
    }

    public static String normalize(String postcode) {
        return postcode == null ? "" : postcode.trim().toUpperCase(Locale.ROOT);
    }

    public static boolean isValid(String postcode) {
        return UK_POSTCODE.matcher(normalize(postcode)).matches();
    }
}
