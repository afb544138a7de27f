package com.cronhooks.schedule;

/**
 * A job schedule is not a valid five-field cron expression.
 */
public class ScheduleParseException extends Exception {
    private final String expression;

    public ScheduleParseException(String expression, Throwable cause) {
        super("invalid cron expression '" + expression + "': " + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.expression = expression;
    }

    public String getExpression() { return expression; }
}
