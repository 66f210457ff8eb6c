package com.mimecast.wren.smtp.verb;

import java.util.regex.Pattern;

/**
 * Envelope address shape check.
 *
 * <p>Accepts the simple {@code local-part@label.label} shape and nothing is checked beyond it.
 * <br>Exactly one {@code @}, the domain must not start with a dot and needs a non-empty final label.
 */
public final class AddressPolicy {

    /**
     * Accepted address shape.
     */
    private static final Pattern ADDRESS = Pattern.compile("^[^@]+@[^@.][^@]*\\.[^@.]+$");

    private AddressPolicy() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Checks address shape.
     *
     * @param address Address with angle brackets already removed.
     * @return Boolean.
     */
    public static boolean isAcceptable(String address) {
        return address != null && ADDRESS.matcher(address).matches();
    }
}
