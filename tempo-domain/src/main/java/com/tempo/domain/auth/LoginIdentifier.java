package com.tempo.domain.auth;

import java.util.regex.Pattern;

/**
 * A login identifier classified as either an email or a user name.
 */
public record LoginIdentifier(Kind kind, String value) {

    public enum Kind {
        EMAIL,
        NAME
    }

    private static final Pattern EMAIL =
            Pattern.compile("^[a-zA-Z0-9_.+-]+@[a-zA-Z0-9-]+\\.[a-zA-Z0-9-.]+$");

    public static LoginIdentifier classify(String raw) {
        String v = raw == null ? "" : raw;
        return new LoginIdentifier(isEmail(v) ? Kind.EMAIL : Kind.NAME, v);
    }

    public static boolean isEmail(String raw) {
        return raw != null && EMAIL.matcher(raw).matches();
    }

    public boolean isEmail() {
        return kind == Kind.EMAIL;
    }
}
