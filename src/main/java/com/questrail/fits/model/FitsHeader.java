package com.questrail.fits.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Immutable, decoded FITS header.
 *
 * <p>Keeps the cards in their original order and a keyword table that maps
 * each keyword to a single card chosen by a {@link DuplicateKeywordPolicy}.
 * Lookups are case-insensitive; keywords are stored upper-cased.</p>
 *
 * <p>The typed accessors return an empty result when a keyword is absent
 * <em>or</em> its value does not parse as the requested type. Callers that
 * must distinguish the two cases can consult {@link #contains(String)}.</p>
 */
public final class FitsHeader
{
    private final List<HeaderRecord> records;
    private final Map<String, HeaderRecord> table;

    public FitsHeader(List<HeaderRecord> records, DuplicateKeywordPolicy policy) {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(policy, "policy");

        this.records = List.copyOf(records);

        final Map<String, HeaderRecord> t = new LinkedHashMap<>();
        for (HeaderRecord r : this.records) {
            if (policy == DuplicateKeywordPolicy.LAST_WINS) {
                t.put(r.keyword(), r);
            } else {
                t.putIfAbsent(r.keyword(), r);
            }
        }
        this.table = Collections.unmodifiableMap(t);
    }

    /**
     * Every card in header order, including repeated and commentary cards.
     */
    public List<HeaderRecord> records() {
        return records;
    }

    /**
     * Keyword to value text, one entry per distinct keyword, in first-seen order.
     */
    public Map<String, String> asMap() {
        final Map<String, String> m = new LinkedHashMap<>();
        table.forEach((k, r) -> m.put(k, r.value()));
        return Collections.unmodifiableMap(m);
    }

    public int size() {
        return table.size();
    }

    public boolean contains(String keyword) {
        return table.containsKey(normalize(keyword));
    }

    public Optional<HeaderRecord> record(String keyword) {
        return Optional.ofNullable(table.get(normalize(keyword)));
    }

    public Optional<String> stringValue(String keyword) {
        return record(keyword).map(HeaderRecord::value);
    }

    /**
     * String value with blank values treated as absent.
     */
    public Optional<String> nonBlankValue(String keyword) {
        return stringValue(keyword).map(String::trim).filter(s -> !s.isEmpty());
    }

    public OptionalInt intValue(String keyword) {
        final Optional<String> text = stringValue(keyword);
        if (text.isEmpty()) {
            return OptionalInt.empty();
        }
        try {
            final long v = Long.parseLong(text.get().trim());
            if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
                return OptionalInt.empty();
            }
            return OptionalInt.of((int) v);
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * Parses a real value. Fortran-style {@code D} exponents are accepted.
     * Non-finite results are treated as absent.
     */
    public OptionalDouble doubleValue(String keyword) {
        final Optional<String> text = stringValue(keyword);
        if (text.isEmpty()) {
            return OptionalDouble.empty();
        }
        final String s = text.get().trim().replace('D', 'E').replace('d', 'e');
        if (s.isEmpty() || !isNumeric(s)) {
            return OptionalDouble.empty();
        }
        try {
            final double v = Double.parseDouble(s);
            return Double.isFinite(v) ? OptionalDouble.of(v) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /**
     * Parses a FITS logical ({@code T} or {@code F}).
     */
    public Optional<Boolean> booleanValue(String keyword) {
        return stringValue(keyword).map(String::trim).flatMap(s -> {
            if ("T".equals(s)) {
                return Optional.of(Boolean.TRUE);
            }
            if ("F".equals(s)) {
                return Optional.of(Boolean.FALSE);
            }
            return Optional.empty();
        });
    }

    /**
     * Parses {@code yyyy-MM-dd'T'HH:mm:ss[.fff]} or {@code yyyy-MM-dd}.
     * A date-only value resolves to the start of that day.
     */
    public Optional<LocalDateTime> dateValue(String keyword) {
        final Optional<String> text = nonBlankValue(keyword);
        if (text.isEmpty()) {
            return Optional.empty();
        }
        final String s = text.get();
        return parseDateTime(s).or(() -> parseDate(s));
    }

    private static Optional<LocalDateTime> parseDateTime(String s) {
        try {
            return Optional.of(LocalDateTime.parse(s));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDateTime> parseDate(String s) {
        try {
            return Optional.of(LocalDate.parse(s).atStartOfDay());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static boolean isNumeric(String s) {
        // Double.parseDouble also accepts "NaN", hex floats and type suffixes.
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (!((c >= '0' && c <= '9') || c == '.' || c == '+' || c == '-' || c == 'E' || c == 'e')) {
                return false;
            }
        }
        return true;
    }

    private static String normalize(String keyword) {
        return Objects.requireNonNull(keyword, "keyword").trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "FitsHeader[cards=" + records.size() + ", keywords=" + table.size() + ']';
    }
}
