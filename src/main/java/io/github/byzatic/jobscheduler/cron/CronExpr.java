package io.github.byzatic.jobscheduler.cron;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.BitSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed cron expression.
 * <p>
 * Accepts 5 fields ({@code min hour dom mon dow}, seconds fixed at 0), 6 fields with a leading
 * seconds field, or one of the descriptors {@code @yearly @annually @monthly @weekly @daily
 * @midnight @hourly}. Fields support {@code *}, {@code ?}, lists, ranges, steps, month names
 * ({@code JAN-DEC}) and weekday names ({@code SUN-SAT}); weekday {@code 7} is Sunday.
 * <p>
 * When both day-of-month and day-of-week are restricted a day matches if either field matches,
 * otherwise both must match.
 */
public final class CronExpr {
    private static final Map<String, String> DESCRIPTORS = Map.of(
            "@yearly", "0 0 1 1 *",
            "@annually", "0 0 1 1 *",
            "@monthly", "0 0 1 * *",
            "@weekly", "0 0 * * 0",
            "@daily", "0 0 * * *",
            "@midnight", "0 0 * * *",
            "@hourly", "0 * * * *"
    );
    private static final String[] MONTH_NAMES =
            {"JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC"};
    private static final String[] DOW_NAMES = {"SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"};

    // search horizon for next(): five years covers Feb 29 and rare dom/dow combinations
    private static final int MAX_YEARS_AHEAD = 5;

    private final String source;
    private final BitSet seconds = new BitSet(60);
    private final BitSet minutes = new BitSet(60);
    private final BitSet hours = new BitSet(24);
    private final BitSet dom = new BitSet(32);    // 1..31
    private final BitSet months = new BitSet(13); // 1..12
    private final BitSet dow = new BitSet(7);     // 0..6 (0=Sunday)
    private boolean domStar;
    private boolean dowStar;

    private CronExpr(String source) {
        this.source = source;
    }

    /**
     * Parses any supported form, including the 6-field form with seconds.
     *
     * @throws IllegalArgumentException if the expression is not valid
     */
    public static @NotNull CronExpr parse(String s) {
        return parse(s, true);
    }

    /**
     * Parses the standard 5-field form or a descriptor. A seconds field is rejected.
     *
     * @throws IllegalArgumentException if the expression is not valid
     */
    public static @NotNull CronExpr parseStandard(String s) {
        return parse(s, false);
    }

    private static CronExpr parse(String s, boolean secondsAllowed) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("Cron expression is empty");
        }
        String trimmed = s.trim();
        String expanded = trimmed;
        if (trimmed.startsWith("@")) {
            expanded = DESCRIPTORS.get(trimmed.toLowerCase(Locale.ROOT));
            if (expanded == null) {
                throw new IllegalArgumentException("Unrecognized descriptor: " + trimmed);
            }
        }

        String[] p = expanded.split("\\s+");
        if (!secondsAllowed && p.length != 5)
            throw new IllegalArgumentException("Cron must have 5 fields (min hour dom mon dow): " + s);
        if (p.length != 5 && p.length != 6)
            throw new IllegalArgumentException("Cron must have 5 or 6 fields (with seconds): " + s);

        CronExpr ce = new CronExpr(trimmed);
        int idx = 0;
        try {
            if (p.length == 6) {
                ce.parseField(p[idx++], 0, 59, ce.seconds, null, false);
            } else {
                ce.seconds.set(0);
            }
            ce.parseField(p[idx++], 0, 59, ce.minutes, null, false);
            ce.parseField(p[idx++], 0, 23, ce.hours, null, false);
            ce.domStar = ce.parseField(p[idx++], 1, 31, ce.dom, null, true);
            ce.parseField(p[idx++], 1, 12, ce.months, MONTH_NAMES, false);
            ce.dowStar = ce.parseField(p[idx], 0, 7, ce.dow, DOW_NAMES, true);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Cron field is not a number in: " + s, e);
        }

        if (ce.seconds.isEmpty() || ce.minutes.isEmpty() || ce.hours.isEmpty()
                || ce.dom.isEmpty() || ce.months.isEmpty() || ce.dow.isEmpty()) {
            throw new IllegalArgumentException("Cron field parsed to empty set: " + s);
        }
        return ce;
    }

    /**
     * @return true if the field is an unrestricted wildcard
     */
    private boolean parseField(String f, int min, int max, BitSet out, String[] names, boolean questionAllowed) {
        if (f.equals("*") || (questionAllowed && f.equals("?"))) {
            setRange(out, min, max, 1, max);
            return true;
        }
        for (String part : f.split(",", -1)) {
            if (part.isEmpty()) throw new IllegalArgumentException("Empty list element in field: " + f);
            String rangePart = part;
            int step = 1;
            boolean hasStep = false;
            if (part.contains("/")) {
                String[] ar = part.split("/", -1);
                if (ar.length != 2) throw new IllegalArgumentException("Bad step: " + part);
                rangePart = ar[0];
                step = Integer.parseInt(ar[1]);
                hasStep = true;
                if (step <= 0) throw new IllegalArgumentException("Step must be positive: " + part);
            }
            int start, end;
            if (rangePart.equals("*") || (questionAllowed && rangePart.equals("?"))) {
                start = min;
                end = max;
            } else if (rangePart.contains("-")) {
                String[] r = rangePart.split("-", -1);
                if (r.length != 2) throw new IllegalArgumentException("Bad range: " + part);
                start = value(r[0], names);
                end = value(r[1], names);
            } else {
                start = value(rangePart, names);
                end = hasStep ? max : start; // "N/step" means "N-max/step"
            }
            if (start < min || end > max || start > end) {
                throw new IllegalArgumentException("Out of range: " + part);
            }
            setRange(out, start, end, step, max);
        }
        return false;
    }

    private static void setRange(BitSet out, int start, int end, int step, int max) {
        for (int v = start; v <= end; v += step) {
            // weekday 7 is an alias of Sunday
            out.set(max == 7 ? v % 7 : v);
        }
    }

    private static int value(String token, String[] names) {
        if (names != null) {
            for (int i = 0; i < names.length; i++) {
                if (names[i].equalsIgnoreCase(token)) {
                    return names == MONTH_NAMES ? i + 1 : i;
                }
            }
        }
        return Integer.parseInt(token);
    }

    private boolean dayMatches(ZonedDateTime z) {
        boolean domMatch = dom.get(z.getDayOfMonth());
        boolean dowMatch = dow.get(z.getDayOfWeek().getValue() % 7);
        if (!domStar && !dowStar) {
            return domMatch || dowMatch;
        }
        return domMatch && dowMatch;
    }

    /**
     * First matching instant strictly after {@code from}, truncated to whole seconds.
     */
    public Optional<Instant> next(Instant from, ZoneId zone) {
        ZonedDateTime z = ZonedDateTime.ofInstant(from, zone)
                .plusSeconds(1)
                .withNano(0);

        int lastYear = z.getYear() + MAX_YEARS_AHEAD;
        while (z.getYear() <= lastYear) {
            if (!months.get(z.getMonthValue())) {
                z = z.plusMonths(1).withDayOfMonth(1).withHour(0).withMinute(0).withSecond(0);
                continue;
            }
            if (!dayMatches(z)) {
                z = z.plusDays(1).withHour(0).withMinute(0).withSecond(0);
                continue;
            }
            if (!hours.get(z.getHour())) {
                z = z.plusHours(1).withMinute(0).withSecond(0);
                continue;
            }
            if (!minutes.get(z.getMinute())) {
                z = z.plusMinutes(1).withSecond(0);
                continue;
            }
            if (!seconds.get(z.getSecond())) {
                z = z.plusSeconds(1);
                continue;
            }
            return Optional.of(z.toInstant());
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return source;
    }
}
