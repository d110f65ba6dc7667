package com.github.roombooking.internal;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Generates reservation ids of the form {@code RES-XXXXXXXX} (8 upper-case hex digits).
 */
public final class ReservationIds {

    public static final String PREFIX = "RES-";

    private static final Pattern FORMAT = Pattern.compile("RES-[0-9A-F]{8}");

    private ReservationIds() {
    }

    public static String next() {
        String hex = UUID.randomUUID().toString().replace("-", "");
        return PREFIX + hex.substring(0, 8).toUpperCase(Locale.ROOT);
    }

    public static boolean isWellFormed(String id) {
        return id != null && FORMAT.matcher(id).matches();
    }
}
