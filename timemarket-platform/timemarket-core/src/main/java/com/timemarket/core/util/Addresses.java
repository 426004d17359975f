package com.timemarket.core.util;

import com.timemarket.core.error.ValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Account address helpers. Addresses are 20-byte hex strings with a 0x prefix;
 * they are compared in lower case.
 */
public final class Addresses {

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private Addresses() {}

    /**
     * Validates and lower-cases an address.
     *
     * @throws ValidationException if the value is null or not a 20-byte hex address
     */
    public static String normalize(String address) {
        if (address == null || !ADDRESS.matcher(address.trim()).matches()) {
            throw new ValidationException("Invalid address: " + address);
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Like {@link #normalize(String)} but also rejects the zero address.
     */
    public static String requireNonZero(String address, String role) {
        String normalized = normalize(address);
        if (ZERO.equals(normalized)) {
            throw new ValidationException(role + " cannot be the zero address");
        }
        return normalized;
    }

    public static boolean isValid(String address) {
        return address != null && ADDRESS.matcher(address.trim()).matches();
    }

    public static boolean same(String a, String b) {
        return a != null && b != null && a.equalsIgnoreCase(b);
    }
}
