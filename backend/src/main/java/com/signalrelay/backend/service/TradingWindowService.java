package com.signalrelay.backend.service;

import com.signalrelay.backend.config.TradingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Evaluates the configured trading window, e.g. {@code MON-FRI 09:30-16:00} or {@code 09:30-16:00},
 * in the trading timezone. A window that cannot be parsed places no restriction.
 */
@Slf4j
@Service
public class TradingWindowService {

    private static final DateTimeFormatter WINDOW_FORMAT = DateTimeFormatter.ofPattern("H:mm");

    private final TradingProperties properties;

    public TradingWindowService(TradingProperties properties) {
        this.properties = properties;
    }

    public record WindowDecision(boolean allowed, String reason) {}

    record WindowSpec(Set<DayOfWeek> days, LocalTime start, LocalTime end) {}

    public WindowDecision evaluate(Instant nowUtc) {
        String raw = properties.getWindow();
        if (raw == null || raw.isBlank()) {
            return new WindowDecision(true, "Trading window disabled");
        }
        WindowSpec spec;
        ZoneId zone;
        try {
            spec = parse(raw);
            zone = ZoneId.of(properties.getTimezone());
        } catch (RuntimeException e) {
            log.warn("Ignoring malformed trading window '{}' ({}): {}", raw, properties.getTimezone(), e.getMessage());
            return new WindowDecision(true, "Trading window malformed, not enforced");
        }
        ZonedDateTime now = nowUtc.atZone(zone);
        if (!spec.days().contains(now.getDayOfWeek())) {
            return new WindowDecision(false, "Outside trading days");
        }
        if (!isWithinRange(now.toLocalTime(), spec.start(), spec.end())) {
            return new WindowDecision(false, "Outside trading window");
        }
        return new WindowDecision(true, "Within trading window");
    }

    static WindowSpec parse(String raw) {
        String[] tokens = raw.trim().split("\\s+");
        if (tokens.length > 2) {
            throw new IllegalArgumentException("Expected '[DAYS] HH:mm-HH:mm'");
        }
        Set<DayOfWeek> days = tokens.length == 2 ? parseDays(tokens[0]) : EnumSet.allOf(DayOfWeek.class);
        String[] times = tokens[tokens.length - 1].split("-");
        if (times.length != 2) {
            throw new IllegalArgumentException("Expected HH:mm-HH:mm");
        }
        try {
            LocalTime start = LocalTime.parse(times[0].trim(), WINDOW_FORMAT);
            LocalTime end = LocalTime.parse(times[1].trim(), WINDOW_FORMAT);
            return new WindowSpec(days, start, end);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Bad time in window: " + e.getParsedString(), e);
        }
    }

    private static Set<DayOfWeek> parseDays(String token) {
        String[] range = token.split("-");
        if (range.length == 1) {
            return EnumSet.of(day(range[0]));
        }
        if (range.length != 2) {
            throw new IllegalArgumentException("Bad day range " + token);
        }
        DayOfWeek from = day(range[0]);
        DayOfWeek to = day(range[1]);
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        DayOfWeek cursor = from;
        days.add(cursor);
        while (cursor != to) {
            cursor = cursor.plus(1);
            days.add(cursor);
        }
        return days;
    }

    private static DayOfWeek day(String token) {
        String upper = token.trim().toUpperCase(Locale.ROOT);
        for (DayOfWeek day : DayOfWeek.values()) {
            if (upper.length() >= 3 && day.name().startsWith(upper)) {
                return day;
            }
        }
        throw new IllegalArgumentException("Unknown day " + token);
    }

    private boolean isWithinRange(LocalTime time, LocalTime start, LocalTime end) {
        if (end.isAfter(start) || end.equals(start)) {
            return !time.isBefore(start) && !time.isAfter(end);
        }
        return !time.isBefore(start) || !time.isAfter(end);
    }
}
