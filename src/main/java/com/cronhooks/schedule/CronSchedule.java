package com.cronhooks.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * A parsed five-field (minute, hour, day-of-month, month, day-of-week) cron expression.
 */
public final class CronSchedule {
    private static final CronDefinition UNIX = CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX);

    private final String expression;
    private final ExecutionTime executionTime;

    private CronSchedule(String expression, ExecutionTime executionTime) {
        this.expression = expression;
        this.executionTime = executionTime;
    }

    public static CronSchedule parse(String expression) throws ScheduleParseException {
        if (expression == null || expression.trim().isEmpty()) {
            throw new ScheduleParseException(String.valueOf(expression), new IllegalArgumentException("empty expression"));
        }
        try {
            Cron cron = new CronParser(UNIX).parse(expression.trim());
            cron.validate();
            return new CronSchedule(expression, ExecutionTime.forCron(cron));
        } catch (IllegalArgumentException e) {
            throw new ScheduleParseException(expression, e);
        }
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (ScheduleParseException e) {
            return false;
        }
    }

    /**
     * First fire time strictly after {@code from}.
     */
    public Optional<ZonedDateTime> nextExecution(ZonedDateTime from) {
        return executionTime.nextExecution(from);
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression;
    }
}
