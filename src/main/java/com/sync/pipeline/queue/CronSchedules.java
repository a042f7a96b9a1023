package com.sync.pipeline.queue;

import org.springframework.scheduling.support.CronExpression;

/**
 * Cron helpers for recurring jobs.
 */
public final class CronSchedules {

    private CronSchedules() {
    }

    /**
     * Cron expression firing every {@code minutes} minutes.
     * Rates that divide an hour or a day use the matching field; other rates fall back to
     * the nearest whole-hour interval.
     */
    public static String everyMinutes(int minutes) {
        if (minutes <= 0) {
            throw new IllegalArgumentException("minutes must be > 0");
        }
        if (minutes < 60) {
            return "0 */" + minutes + " * * * *";
        }
        int hours = Math.max(1, Math.round(minutes / 60f));
        if (hours < 24) {
            return "0 0 */" + hours + " * * *";
        }
        return "0 0 0 * * *";
    }

    /**
     * Parses a 5-field (minute precision) or 6-field (second precision) cron expression.
     *
     * @throws IllegalArgumentException when the expression is invalid
     */
    public static CronExpression parse(String cron) {
        if (cron == null || cron.isBlank()) {
            throw new IllegalArgumentException("cron expression is required");
        }
        String trimmed = cron.trim();
        String[] fields = trimmed.split("\\s+");
        String normalized = fields.length == 5 ? "0 " + trimmed : trimmed;
        return CronExpression.parse(normalized);
    }
}
