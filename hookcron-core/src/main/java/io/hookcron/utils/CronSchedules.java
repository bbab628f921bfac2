package io.hookcron.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.TimeZone;
import java.util.regex.Pattern;

/**
 * Evaluates cron expressions with Quartz.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>standard 5-field cron: "*&#47;5 * * * *" (seconds are set to 0)</li>
 *   <li>6-field cron with leading seconds and no "?": "30 0 9 * * 1-5"</li>
 *   <li>Quartz 6/7-field cron with "?" in day-of-month or day-of-week: "0 0 2 ? * MON"</li>
 * </ul>
 * <p>
 * Standard expressions number the days of the week 0-7 with both 0 and 7 meaning Sunday; they
 * are renumbered to Quartz's 1 = SUN. Quartz expressions are passed through. Day names (MON-FRI)
 * mean the same in both.
 */
public final class CronSchedules {
    private static final Pattern DAY_NUMBER = Pattern.compile("\\d+");

    private CronSchedules() {
    }

    /**
     * Normalize cron expressions to Quartz syntax:
     * - Accepts 5-field cron by prepending seconds "0".
     * - Renumbers the day-of-week of standard expressions.
     * - Replaces an unrestricted day-of-month or day-of-week with "?" as Quartz requires.
     *
     * @throws IllegalArgumentException if a standard expression restricts both day fields
     */
    public static String normalizeCron(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("expression must not be null");
        }
        String s = expression.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("expression must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return fromStandardCron(expression, "0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6 && !"?".equals(parts[3]) && !"?".equals(parts[5])) {
            return fromStandardCron(expression, parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    private static String fromStandardCron(String expression, String sec, String min, String hour,
                                           String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = toQuartzDayOfWeek(dayOfWeek);

        if ("*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom)) {
            dom = "?";
        } else {
            // standard cron fires when either field matches; Quartz has no such mode
            throw new IllegalArgumentException("Cron expression restricts both day-of-month and day-of-week, "
                    + "which is unsupported by Quartz: " + expression);
        }
        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    /**
     * Renumber a standard day-of-week field (0-7, 0 and 7 = Sunday) to Quartz (1-7, 1 = SUN).
     * Lists, ranges and steps are kept; only day numbers change, step sizes do not.
     */
    static String toQuartzDayOfWeek(String field) {
        String[] items = field.split(",");
        for (int i = 0; i < items.length; i++) {
            String item = items[i];
            int slash = item.indexOf('/');
            String range = slash < 0 ? item : item.substring(0, slash);
            String step = slash < 0 ? "" : item.substring(slash);

            String[] bounds = range.split("-", -1);
            for (int b = 0; b < bounds.length; b++) {
                if (DAY_NUMBER.matcher(bounds[b]).matches()) {
                    int day = Integer.parseInt(bounds[b]);
                    bounds[b] = String.valueOf(day == 0 || day == 7 ? 1 : day + 1);
                }
            }
            items[i] = String.join("-", bounds) + step;
        }
        return String.join(",", items);
    }

    /**
     * Parse a cron expression bound to a time zone.
     *
     * @throws IllegalArgumentException if the expression is not valid
     */
    public static CronExpression parse(String expression, ZoneId zone) {
        String normalized = normalizeCron(expression);
        try {
            CronExpression exp = new CronExpression(normalized);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + expression + " (" + ex.getMessage() + ")", ex);
        }
    }

    /**
     * Next occurrence strictly after {@code after}, or null when the expression never fires again.
     */
    public static Instant nextFireTime(CronExpression exp, Instant after) {
        Date next = exp.getNextValidTimeAfter(Date.from(after));
        return next == null ? null : next.toInstant();
    }

    /**
     * Resolve an IANA zone id; null or blank means system default.
     *
     * @throws java.time.DateTimeException if the id is not a valid zone
     */
    public static ZoneId zoneOf(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(timezone.trim());
    }
}
