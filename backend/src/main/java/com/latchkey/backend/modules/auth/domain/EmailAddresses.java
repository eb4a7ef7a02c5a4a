package com.latchkey.backend.modules.auth.domain;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalization and format rules applied wherever an email is written or looked up.
 */
public final class EmailAddresses {

    public static final int MAX_LENGTH = 320;

    private static final Pattern FORMAT = Pattern.compile(
            "^[a-zA-Z0-9.!#$%&'*+/=?^_`{|}~-]+@[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?"
                    + "(?:\\.[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?)*$"
    );

    private EmailAddresses() {
    }

    public static String normalize(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isValid(String email) {
        return email != null
                && !email.isEmpty()
                && email.length() <= MAX_LENGTH
                && FORMAT.matcher(email).matches();
    }
}
