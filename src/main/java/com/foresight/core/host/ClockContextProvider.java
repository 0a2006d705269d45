package com.foresight.core.host;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.LinkedHashMap;
import java.util.Locale;

/**
 * Reports the current time of day so analyses can reason about market hours.
 */
@Component
public class ClockContextProvider implements ContextProvider {

    private final Clock clock;

    public ClockContextProvider() {
        this(Clock.systemUTC());
    }

    ClockContextProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "clock";
    }

    @Override
    public Object provide() {
        var now = ZonedDateTime.now(clock);
        var payload = new LinkedHashMap<String, String>();
        payload.put("timestamp", DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(now));
        payload.put("dayOfWeek", now.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
        payload.put("timeOfDay", timeOfDay(now.getHour()));
        payload.put("zone", now.getZone().getId());
        return payload;
    }

    static String timeOfDay(int hour) {
        if (hour < 6) return "night";
        if (hour < 12) return "morning";
        if (hour < 18) return "afternoon";
        return "evening";
    }
}
