package com.postqueue.core;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * When a job fires: either once at a fixed instant, or on every tick of a cron
 * expression.
 *
 * <p>This is a closed, tagged variant. The only subclasses are {@link OneTime}
 * and {@link Recurring}; callers switch on {@link #getKind()} and cast, or use
 * the {@code asOneTime()}/{@code asRecurring()} accessors.</p>
 *
 * <p>Instances are immutable and safe to share between the mutation path and
 * firing callbacks.</p>
 *
 * <pre>{@code
 * Schedule once = Schedule.oneTime(Instant.parse("2026-12-25T15:30:00Z"));
 * Schedule daily = Schedule.recurring("0 15 * * *");
 * }</pre>
 */
public abstract class Schedule {

    /** Zone recurring schedules are evaluated in unless told otherwise. */
    public static final ZoneId DEFAULT_ZONE = ZoneOffset.UTC;

    private Schedule() {
    }

    public static OneTime oneTime(Instant at) {
        return new OneTime(at);
    }

    public static Recurring recurring(String cronExpression) {
        return new Recurring(cronExpression, DEFAULT_ZONE);
    }

    public static Recurring recurring(String cronExpression, ZoneId zone) {
        return new Recurring(cronExpression, zone);
    }

    public abstract ScheduleKind getKind();

    public OneTime asOneTime() {
        throw new IllegalStateException("Schedule is " + getKind() + ", not one_time");
    }

    public Recurring asRecurring() {
        throw new IllegalStateException("Schedule is " + getKind() + ", not recurring");
    }

    /**
     * Fires exactly once at {@link #getAt()}.
     */
    public static final class OneTime extends Schedule {
        private final Instant at;

        private OneTime(Instant at) {
            this.at = Objects.requireNonNull(at, "at");
        }

        public Instant getAt() {
            return at;
        }

        @Override
        public ScheduleKind getKind() {
            return ScheduleKind.ONE_TIME;
        }

        @Override
        public OneTime asOneTime() {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof OneTime && ((OneTime) o).at.equals(at);
        }

        @Override
        public int hashCode() {
            return at.hashCode();
        }

        @Override
        public String toString() {
            return "one_time(" + at + ")";
        }
    }

    /**
     * Fires on every matching tick of a five-field UNIX cron expression.
     */
    public static final class Recurring extends Schedule {
        private final String cronExpression;
        private final ZoneId zone;

        private Recurring(String cronExpression, ZoneId zone) {
            this.cronExpression = Objects.requireNonNull(cronExpression, "cronExpression").trim();
            this.zone = zone != null ? zone : DEFAULT_ZONE;
        }

        public String getCronExpression() {
            return cronExpression;
        }

        public ZoneId getZone() {
            return zone;
        }

        @Override
        public ScheduleKind getKind() {
            return ScheduleKind.RECURRING;
        }

        @Override
        public Recurring asRecurring() {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Recurring)) {
                return false;
            }
            Recurring other = (Recurring) o;
            return cronExpression.equals(other.cronExpression) && zone.equals(other.zone);
        }

        @Override
        public int hashCode() {
            return Objects.hash(cronExpression, zone);
        }

        @Override
        public String toString() {
            return "recurring(" + cronExpression + ", " + zone + ")";
        }
    }
}
