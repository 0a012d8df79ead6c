package com.volumemonitor.calendar;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Trading calendar configuration under the {@code trading-calendar} prefix: the monitoring
 * session window, its timezone, and the NSE holiday list.
 *
 * <p>The session window defaults to 09:00-15:30, which covers the pre-open auction so the
 * first baselines are seeded before continuous trading starts. The holiday list is updated
 * annually from the NSE published calendar.
 */
@Component
@ConfigurationProperties(prefix = "trading-calendar")
public class HolidayCalendarConfig {

    private String exchange = "NSE";
    private String timezone = "Asia/Kolkata";
    private LocalTime sessionStart = LocalTime.of(9, 0);
    private LocalTime sessionEnd = LocalTime.of(15, 30);
    private List<Holiday> holidays = new ArrayList<>();

    public String getExchange() {
        return exchange;
    }

    public void setExchange(String exchange) {
        this.exchange = exchange;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public LocalTime getSessionStart() {
        return sessionStart;
    }

    public void setSessionStart(LocalTime sessionStart) {
        this.sessionStart = sessionStart;
    }

    public LocalTime getSessionEnd() {
        return sessionEnd;
    }

    public void setSessionEnd(LocalTime sessionEnd) {
        this.sessionEnd = sessionEnd;
    }

    public List<Holiday> getHolidays() {
        return holidays;
    }

    public void setHolidays(List<Holiday> holidays) {
        this.holidays = holidays;
    }

    /**
     * A single holiday entry on the trading calendar.
     */
    public static class Holiday {

        private LocalDate date;
        private String name;
        private HolidayType type;

        public LocalDate getDate() {
            return date;
        }

        public void setDate(LocalDate date) {
            this.date = date;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public HolidayType getType() {
            return type;
        }

        public void setType(HolidayType type) {
            this.type = type;
        }
    }
}
