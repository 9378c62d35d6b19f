package com.gridcore.calc.fill.patterns;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text split around its first run of digits: {@code "Item 007b"} is
 * {@code ("Item ", 7, "b")} with a three-digit zero-padded counter.
 */
public record NumberedText(String prefix, long number, int width, boolean zeroPadded, String suffix) {
    private static final Pattern SHAPE = Pattern.compile("^(.*?)(\\d+)(.*)$", Pattern.DOTALL);

    public static Optional<NumberedText> parse(String text) {
        Matcher m = SHAPE.matcher(text);
        if (!m.matches())
            return Optional.empty();
        String digits = m.group(2);
        if (digits.length() > 18)
            return Optional.empty();
        return Optional.of(new NumberedText(m.group(1), Long.parseLong(digits), digits.length(),
                digits.length() > 1 && digits.charAt(0) == '0', m.group(3)));
    }

    public boolean sameShape(NumberedText other) {
        return prefix.equals(other.prefix) && suffix.equals(other.suffix);
    }

    /** This text with the counter replaced; padding is kept and the counter never drops below zero. */
    public String withNumber(long n) {
        long value = Math.max(0, n);
        String digits = zeroPadded ? String.format("%0" + width + "d", value) : Long.toString(value);
        return prefix + digits + suffix;
    }
}
