package com.fastticker.exception;

public class InvalidCronExpressionException extends TickerValidationException {

    private final String expression;

    public InvalidCronExpressionException(String expression, String reason) {
        super("invalid cron expression '" + expression + "': " + reason);
        this.expression = expression;
    }

    public InvalidCronExpressionException(String expression, Throwable cause) {
        super("invalid cron expression '" + expression + "': " + cause.getMessage(), cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
