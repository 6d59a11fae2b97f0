package com.postqueue.core;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Cron parsing and next-tick computation for recurring schedules.
 *
 * <p>Expressions use the classic five-field UNIX layout
 * ({@code minute hour day-of-month month day-of-week}), e.g.
 * {@code "0 15 * * *"} for every day at 15:00.</p>
 *
 * <p>Expressions are evaluated in UTC. A zone with daylight-saving rules
 * would make some local times occur twice and others never, so any zone
 * other than UTC (or an alias of it such as {@code Etc/UTC} or {@code Z}) is
 * rejected.</p>
 */
public final class CronSchedules {

    private static final CronDefinition DEFINITION = CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX);
    private static final CronParser PARSER = new CronParser(DEFINITION);

    private CronSchedules() {
    }

    /**
     * Parse and validate a cron expression.
     *
     * @param expression the cron expression
     * @return the parsed cron
     * @throws InvalidScheduleException if the expression is blank or malformed
     */
    public static Cron parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("Cron expression must not be empty", expression);
        }
        try {
            return PARSER.parse(expression.trim()).validate();
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(
                "Invalid cron expression '" + expression + "': " + e.getMessage(), expression, e);
        }
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidScheduleException e) {
            return false;
        }
    }

    public static boolean isUtc(ZoneId zone) {
        return zone != null && ZoneOffset.UTC.equals(zone.normalized());
    }

    /**
     * Build the execution-time calculator for a recurring schedule.
     *
     * @throws InvalidScheduleException if the expression is malformed or the
     *         schedule's zone is not UTC
     */
    public static ExecutionTime executionTime(Schedule.Recurring schedule) {
        Cron cron = parse(schedule.getCronExpression());
        if (!isUtc(schedule.getZone())) {
            throw new InvalidScheduleException(
                "Cron schedules are evaluated in UTC; time zone " + schedule.getZone() + " is not supported",
                String.valueOf(schedule.getZone()));
        }
        return ExecutionTime.forCron(cron);
    }

    /**
     * Compute the first tick strictly after {@code after}, evaluated in UTC.
     *
     * @return the next tick, or empty if the expression never matches again
     */
    public static Optional<ZonedDateTime> nextFireTime(Schedule.Recurring schedule, ZonedDateTime after) {
        return executionTime(schedule).nextExecution(after.withZoneSameInstant(schedule.getZone()));
    }
}
