package com.gridcore.calc.fill.patterns;

import com.gridcore.calc.model.CellValue;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A date read from a cell, remembering how it was written so that generated
 * dates come out in the same form.
 */
public record FillDate(LocalDate date, Format format) {
    /** Day zero of serial date numbers. */
    public static final LocalDate SERIAL_EPOCH = LocalDate.of(1900, 1, 1);

    public enum Format {
        ISO(Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})"), 1, 2, 3),
        US(Pattern.compile("(\\d{2})/(\\d{2})/(\\d{4})"), 3, 1, 2),
        EU(Pattern.compile("(\\d{2})/(\\d{2})/(\\d{4})"), 3, 2, 1),
        ISO_SLASH(Pattern.compile("(\\d{4})/(\\d{2})/(\\d{2})"), 1, 2, 3),
        SERIAL(null, 0, 0, 0);

        private final Pattern pattern;
        private final int yearGroup;
        private final int monthGroup;
        private final int dayGroup;

        Format(Pattern pattern, int yearGroup, int monthGroup, int dayGroup) {
            this.pattern = pattern;
            this.yearGroup = yearGroup;
            this.monthGroup = monthGroup;
            this.dayGroup = dayGroup;
        }

        private LocalDate match(String text) {
            Matcher m = pattern.matcher(text);
            if (!m.matches())
                return null;
            int year = Integer.parseInt(m.group(yearGroup));
            int month = Integer.parseInt(m.group(monthGroup));
            int day = Integer.parseInt(m.group(dayGroup));
            if (month < 1 || month > 12 || day < 1 || !YearMonth.of(year, month).isValidDay(day))
                return null;
            return LocalDate.of(year, month, day);
        }
    }

    /**
     * Reads text in one of the supported layouts (tried in declaration order, so
     * an ambiguous {@code 01/02/2024} is month-first) or a serial number.
     */
    public static Optional<FillDate> parse(CellValue value) {
        if (value instanceof CellValue.Number n) {
            if (Double.isNaN(n.value()) || Math.abs(n.value()) > 3_000_000)
                return Optional.empty();
            return Optional.of(new FillDate(SERIAL_EPOCH.plusDays((long) Math.floor(n.value())), Format.SERIAL));
        }
        if (!(value instanceof CellValue.Text t))
            return Optional.empty();
        String s = t.value().trim();
        for (Format f : Format.values()) {
            if (f == Format.SERIAL)
                continue;
            LocalDate d = f.match(s);
            if (d != null)
                return Optional.of(new FillDate(d, f));
        }
        return Optional.empty();
    }

    public long daysUntil(FillDate other) {
        return ChronoUnit.DAYS.between(date, other.date);
    }

    /** The date {@code days} later, rendered in this date's format. */
    public CellValue plusDays(long days) {
        LocalDate d = date.plusDays(days);
        return switch (format) {
            case ISO -> CellValue.text(String.format("%04d-%02d-%02d", d.getYear(), d.getMonthValue(), d.getDayOfMonth()));
            case US -> CellValue.text(String.format("%02d/%02d/%04d", d.getMonthValue(), d.getDayOfMonth(), d.getYear()));
            case EU -> CellValue.text(String.format("%02d/%02d/%04d", d.getDayOfMonth(), d.getMonthValue(), d.getYear()));
            case ISO_SLASH -> CellValue.text(String.format("%04d/%02d/%02d", d.getYear(), d.getMonthValue(), d.getDayOfMonth()));
            case SERIAL -> CellValue.number(ChronoUnit.DAYS.between(SERIAL_EPOCH, d));
        };
    }
}
