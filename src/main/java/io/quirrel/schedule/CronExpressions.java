package io.quirrel.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import io.quirrel.ErrorCode;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * 5-field UNIX cron expressions, evaluated in UTC.
 */
public final class CronExpressions {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private CronExpressions() {
    }

    public static String validate(String expression) {
        parse(expression);
        return expression.trim();
    }

    public static Optional<Instant> nextExecution(String expression, Instant after) {
        ExecutionTime et = ExecutionTime.forCron(parse(expression));
        return et.nextExecution(ZonedDateTime.ofInstant(after, ZoneOffset.UTC))
                .map(ZonedDateTime::toInstant);
    }

    private static Cron parse(String expression) {
        String expr = expression == null ? "" : expression.trim();
        if (expr.isEmpty() || expr.split("\\s+").length != 5) {
            throw invalid(expression, null);
        }
        try {
            Cron cron = PARSER.parse(expr);
            cron.validate();
            return cron;
        } catch (IllegalArgumentException e) {
            throw invalid(expression, e);
        }
    }

    private static ValidationException invalid(String expression, Exception cause) {
        String detail = cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage();
        return new ValidationException(
                ErrorCode.INVALID_CRON_EXPRESSION,
                "Invalid cron expression '" + expression + "', expected 5 fields (minute hour day month weekday)" + detail
        );
    }
}
