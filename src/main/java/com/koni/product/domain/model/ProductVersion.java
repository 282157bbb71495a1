package com.koni.product.domain.model;

import com.koni.product.domain.exception.MalformedVersionException;
import lombok.EqualsAndHashCode;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Version value object for product events.
 * A version is rendered as {@code "v" + n}; parsing accepts nothing else.
 */
@EqualsAndHashCode
public final class ProductVersion {

    private static final Pattern FORMAT = Pattern.compile("v([0-9]+)");
    private static final ProductVersion INITIAL = new ProductVersion(1L);

    private final long number;

    private ProductVersion(long number) {
        this.number = number;
    }

    /**
     * The version assigned to a product that has never been published.
     */
    public static ProductVersion initial() {
        return INITIAL;
    }

    /**
     * Parses a version string such as {@code "v3"}.
     *
     * @param value the raw version string
     * @return the parsed version
     * @throws MalformedVersionException if the value is null, lacks the {@code v} prefix,
     *         has a non-numeric suffix or does not fit in a long
     */
    public static ProductVersion parse(String value) {
        if (value == null) {
            throw new MalformedVersionException("Version is required");
        }
        Matcher matcher = FORMAT.matcher(value);
        if (!matcher.matches()) {
            throw new MalformedVersionException("Malformed version '" + value + "': expected v<digits>");
        }
        try {
            return new ProductVersion(Long.parseLong(matcher.group(1)));
        } catch (NumberFormatException e) {
            throw new MalformedVersionException("Malformed version '" + value + "': number out of range", e);
        }
    }

    /**
     * Returns the version that follows this one.
     *
     * @throws MalformedVersionException if this version is already the largest representable one
     */
    public ProductVersion next() {
        if (number == Long.MAX_VALUE) {
            throw new MalformedVersionException("Version v" + number + " cannot be incremented");
        }
        return new ProductVersion(number + 1);
    }

    public long getNumber() {
        return number;
    }

    @Override
    public String toString() {
        return "v" + number;
    }
}
