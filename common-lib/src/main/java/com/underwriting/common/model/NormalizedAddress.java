package com.underwriting.common.model;

import com.underwriting.common.exception.InvalidAddressException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A US street address reduced to one canonical spelling: trimmed, single-spaced and
 * upper-cased. Two inputs that differ only in case or whitespace normalize to equal
 * instances and therefore share a cache entry.
 *
 * <p>Instances are only obtainable through {@link #of} and {@link #parse}, both of which
 * reject blank or malformed components with {@link InvalidAddressException}.
 */
public record NormalizedAddress(String line1, String city, String state, String zip) {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern STATE      = Pattern.compile("[A-Z]{2}");
    private static final Pattern ZIP        = Pattern.compile("(\\d{5})(-\\d{4})?");

    public NormalizedAddress {
        line1 = clean("line1", line1, true);
        city  = clean("city", city, true);
        state = clean("state", state, false);
        zip   = clean("zip", zip, false);

        if (!STATE.matcher(state).matches()) {
            throw new InvalidAddressException("state", "must be a two-letter code, got '" + state + "'");
        }
        Matcher zipMatch = ZIP.matcher(zip);
        if (!zipMatch.matches()) {
            throw new InvalidAddressException("zip", "must be five digits (optionally ZIP+4), got '" + zip + "'");
        }
        zip = zipMatch.group(1);
    }

    public static NormalizedAddress of(String line1, String city, String state, String zip) {
        return new NormalizedAddress(line1, city, state, zip);
    }

    /**
     * Parses the one-line form {@code "123 Main St, Boston, MA 02129"}. Extra comma-separated
     * segments before the city (unit numbers and the like) are folded into {@code line1}.
     */
    public static NormalizedAddress parse(String oneLine) {
        if (oneLine == null || oneLine.isBlank()) {
            throw new InvalidAddressException("address", "must not be blank");
        }
        String[] parts = oneLine.split(",");
        if (parts.length < 3) {
            throw new InvalidAddressException("address",
                "expected 'line1, city, STATE ZIP', got '" + oneLine.trim() + "'");
        }
        String stateZip = parts[parts.length - 1].trim();
        String city     = parts[parts.length - 2];
        String line1    = String.join(",", Arrays.copyOfRange(parts, 0, parts.length - 2));

        String[] tail = WHITESPACE.split(stateZip);
        if (tail.length != 2) {
            throw new InvalidAddressException("address",
                "expected 'STATE ZIP' after the city, got '" + stateZip + "'");
        }
        return new NormalizedAddress(line1, city, tail[0], tail[1]);
    }

    /** One-line rendering, the inverse of {@link #parse}. */
    public String format() {
        return line1 + ", " + city + ", " + state + " " + zip;
    }

    /**
     * SHA-256 over the normalized components. Used as the response cache key and stored
     * alongside persisted snapshots.
     */
    public String cacheKey() {
        String identity = String.join("|", line1, city, state, zip);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(identity.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String clean(String component, String raw, boolean stripTrailingPunctuation) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidAddressException(component, "must not be blank");
        }
        String value = WHITESPACE.matcher(raw.trim()).replaceAll(" ").toUpperCase(Locale.ROOT);
        if (stripTrailingPunctuation) {
            value = value.replaceAll("[.,;]+$", "").trim();
            if (value.isEmpty()) {
                throw new InvalidAddressException(component, "must not be blank");
            }
        }
        return value;
    }
}
