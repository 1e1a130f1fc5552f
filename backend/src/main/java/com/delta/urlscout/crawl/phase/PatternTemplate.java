package com.delta.urlscout.crawl.phase;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A path with one variable slot: {@code prefix + value + suffix}. Year-month templates encode the
 * value as {@code year * 12 + month - 1} and render it as {@code yyyy/MM}.
 */
final class PatternTemplate {
    enum Kind {
        NUMBER,
        YEAR,
        YEAR_MONTH
    }

    private static final Pattern YEAR = Pattern.compile("^20[0-3]\\d$");
    private static final Pattern MONTH = Pattern.compile("^(0[1-9]|1[0-2])$");
    private static final Pattern PREFIXED_NUMBER = Pattern.compile("^([A-Za-z_-]*)(\\d{1,9})$");
    private static final int MIN_YEAR = 2000;

    private final String prefix;
    private final String suffix;
    private final Kind kind;
    private final int width;
    private final NavigableSet<Integer> samples = new TreeSet<>();
    private String origin = "";

    PatternTemplate(String prefix, String suffix, Kind kind, int width) {
        this.prefix = prefix;
        this.suffix = suffix;
        this.kind = kind;
        this.width = width;
    }

    String key() {
        return prefix + "{" + kind.name().toLowerCase(Locale.ROOT) + (width > 0 ? ":" + width : "") + "}" + suffix;
    }

    String origin() {
        return origin;
    }

    void bindOrigin(String value) {
        this.origin = value == null ? "" : value;
    }

    Kind kind() {
        return kind;
    }

    NavigableSet<Integer> samples() {
        return samples;
    }

    void addSample(int value) {
        samples.add(value);
    }

    String render(int value) {
        return switch (kind) {
            case YEAR -> prefix + value + suffix;
            case YEAR_MONTH -> prefix + (value / 12) + "/" + String.format(Locale.ROOT, "%02d", value % 12 + 1) + suffix;
            case NUMBER -> prefix + (width > 0 ? String.format(Locale.ROOT, "%0" + width + "d", value) : Integer.toString(value)) + suffix;
        };
    }

    /**
     * Values to try, in order: gaps between observed samples, then values after the largest,
     * then values before the smallest. At most {@code limit} values; never beyond
     * {@code latest} for date kinds.
     */
    List<Integer> variants(int limit, YearMonth latest) {
        List<Integer> values = new ArrayList<>();
        if (samples.isEmpty()) {
            return values;
        }
        int min = samples.first();
        int max = samples.last();
        for (int value = min + 1; value < max && values.size() < limit; value++) {
            if (!samples.contains(value)) {
                values.add(value);
            }
        }
        int upper = upperBound(latest);
        for (int value = max + 1; value <= upper && values.size() < limit; value++) {
            values.add(value);
        }
        int lower = lowerBound(min);
        for (int value = min - 1; value >= lower && values.size() < limit; value--) {
            values.add(value);
        }
        return values;
    }

    private int upperBound(YearMonth latest) {
        return switch (kind) {
            case YEAR -> latest.getYear() + 1;
            case YEAR_MONTH -> latest.getYear() * 12 + latest.getMonthValue() - 1;
            case NUMBER -> Integer.MAX_VALUE - 1;
        };
    }

    private int lowerBound(int min) {
        return switch (kind) {
            case YEAR -> MIN_YEAR;
            case YEAR_MONTH -> MIN_YEAR * 12;
            case NUMBER -> min == 0 ? 0 : 1;
        };
    }

    /**
     * Template and sample value for the last variable segment of {@code path}, or {@code null}
     * when the path has none.
     */
    static Parsed parse(String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        String[] segments = path.split("/", -1);
        for (int i = segments.length - 1; i >= 0; i--) {
            String segment = segments[i];
            String name = segment;
            String extension = "";
            if (i == segments.length - 1) {
                int dot = segment.lastIndexOf('.');
                if (dot > 0) {
                    name = segment.substring(0, dot);
                    extension = segment.substring(dot);
                }
            }
            if (name.isEmpty()) {
                continue;
            }
            String before = join(segments, 0, i);
            String after = extension + (i < segments.length - 1 ? "/" + join(segments, i + 1, segments.length) : "");
            if (MONTH.matcher(name).matches() && i > 0 && YEAR.matcher(segments[i - 1]).matches()) {
                String yearPrefix = join(segments, 0, i - 1);
                int value = Integer.parseInt(segments[i - 1]) * 12 + Integer.parseInt(name) - 1;
                return new Parsed(new PatternTemplate(yearPrefix + "/", after, Kind.YEAR_MONTH, 0), value);
            }
            if (YEAR.matcher(name).matches()) {
                return new Parsed(new PatternTemplate(before + "/", after, Kind.YEAR, 0), Integer.parseInt(name));
            }
            Matcher matcher = PREFIXED_NUMBER.matcher(name);
            if (matcher.matches()) {
                String digits = matcher.group(2);
                int width = digits.length() > 1 && digits.startsWith("0") ? digits.length() : 0;
                return new Parsed(
                    new PatternTemplate(before + "/" + matcher.group(1), after, Kind.NUMBER, width),
                    Integer.parseInt(digits)
                );
            }
        }
        return null;
    }

    private static String join(String[] segments, int from, int to) {
        StringBuilder out = new StringBuilder();
        for (int i = from; i < to; i++) {
            if (i > from) {
                out.append('/');
            }
            out.append(segments[i]);
        }
        return out.toString();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PatternTemplate)) {
            return false;
        }
        return key().equals(((PatternTemplate) other).key());
    }

    @Override
    public int hashCode() {
        return Objects.hash(key());
    }

    record Parsed(PatternTemplate template, int value) {
    }
}
