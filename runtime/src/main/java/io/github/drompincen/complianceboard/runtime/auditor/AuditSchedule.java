package io.github.drompincen.complianceboard.runtime.auditor;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Auditor schedules: the literal {@code manual} (or empty) for no schedule, otherwise a standard five-field
 * cron expression (minute hour day-of-month month day-of-week).
 */
public final class AuditSchedule {

    public static final String MANUAL = "manual";

    public enum Preset {
        MANUAL(AuditSchedule.MANUAL, "Manual"),
        DAILY("0 0 * * *", "Daily"),
        WEEKLY("0 0 * * 1", "Weekly (Monday)"),
        MONTHLY("0 0 1 * *", "Monthly"),
        QUARTERLY("0 0 1 */3 *", "Quarterly"),
        CUSTOM(null, "Custom");

        private final String expression;
        private final String label;

        Preset(String expression, String label) {
            this.expression = expression;
            this.label = label;
        }

        public String expression() { return expression; }

        public String label() { return label; }
    }

    private AuditSchedule() {}

    public static boolean isManual(String schedule) {
        return schedule == null || schedule.isBlank() || MANUAL.equals(schedule.trim().toLowerCase(Locale.ROOT));
    }

    /** Canonical form: {@code manual} or the trimmed cron with single spaces. */
    public static String normalize(String schedule) {
        if (isManual(schedule)) return MANUAL;
        return String.join(" ", schedule.trim().split("\\s+"));
    }

    public static Preset presetOf(String schedule) {
        String normalized = normalize(schedule);
        return Arrays.stream(Preset.values())
                .filter(p -> normalized.equals(p.expression()))
                .findFirst()
                .orElse(Preset.CUSTOM);
    }

    /** Returns the problem with the schedule, or empty when it is usable. */
    public static Optional<String> validate(String schedule) {
        if (isManual(schedule)) return Optional.empty();
        String[] fields = schedule.trim().split("\\s+");
        if (fields.length != 5) {
            return Optional.of("Schedule must be 'manual' or a 5-field cron expression");
        }
        try {
            toCron(schedule);
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            return Optional.of("Invalid cron expression: " + e.getMessage());
        }
    }

    /** Next fire time strictly after {@code after}; empty for manual or unparseable schedules. */
    public static Optional<Instant> nextRun(String schedule, Instant after, ZoneId zone) {
        if (isManual(schedule) || validate(schedule).isPresent()) return Optional.empty();
        ZonedDateTime next = toCron(schedule).next(after.atZone(zone));
        return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
    }

    // Spring cron carries a leading seconds field.
    private static CronExpression toCron(String schedule) {
        return CronExpression.parse("0 " + normalize(schedule));
    }
}
