package com.volumemonitor.calendar;

import com.volumemonitor.domain.enums.MarketPhase;
import com.volumemonitor.event.MarketStatusEvent;
import com.volumemonitor.exception.ConfigurationException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Market hours awareness for monitoring: the session gate, holiday detection, and NSE phase
 * transitions.
 *
 * <p>The polling engine asks {@link #isOpen(Instant)} on every tick and stops itself once
 * {@link #isSessionOver(Instant)} turns true. Separately, the phase is polled every 5 seconds and
 * a {@link MarketStatusEvent} is published on each transition for the frontend.
 *
 * <p>Holiday data and the session window are loaded from YAML via {@link HolidayCalendarConfig}.
 */
@Service
public class TradingCalendarService implements MarketCalendar {

    private static final Logger log = LoggerFactory.getLogger(TradingCalendarService.class);

    private final HolidayCalendarConfig holidayCalendarConfig;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;
    private final AtomicReference<MarketPhase> currentPhase = new AtomicReference<>(MarketPhase.CLOSED);

    public TradingCalendarService(
            HolidayCalendarConfig holidayCalendarConfig, ApplicationEventPublisher applicationEventPublisher, Clock clock) {
        this.holidayCalendarConfig = holidayCalendarConfig;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    @Override
    public boolean isOpen(Instant now) {
        ZonedDateTime local = toExchangeTime(now);
        LocalTime time = local.toLocalTime();
        return isTradingDay(local.toLocalDate())
                && !time.isBefore(holidayCalendarConfig.getSessionStart())
                && time.isBefore(holidayCalendarConfig.getSessionEnd());
    }

    /**
     * True at or after the session end on a trading day. Weekends and holidays never report
     * the session as over; the gate just stays closed until the next trading day opens.
     */
    @Override
    public boolean isSessionOver(Instant now) {
        ZonedDateTime local = toExchangeTime(now);
        return isTradingDay(local.toLocalDate())
                && !local.toLocalTime().isBefore(holidayCalendarConfig.getSessionEnd());
    }

    @Override
    public void validateSessionWindow() {
        List<String> violations = new ArrayList<>();
        LocalTime start = holidayCalendarConfig.getSessionStart();
        LocalTime end = holidayCalendarConfig.getSessionEnd();
        if (start == null || end == null) {
            violations.add("trading-calendar.session-start and session-end are required");
        } else if (!start.isBefore(end)) {
            violations.add("trading-calendar.session-start " + start + " must be before session-end " + end);
        }
        String timezone = holidayCalendarConfig.getTimezone();
        if (timezone == null) {
            violations.add("trading-calendar.timezone is required");
        } else {
            try {
                ZoneId.of(timezone);
            } catch (DateTimeException e) {
                violations.add("trading-calendar.timezone is invalid: " + timezone);
            }
        }
        if (!violations.isEmpty()) {
            throw new ConfigurationException("Invalid market-hours window", violations);
        }
    }

    /**
     * Checks for market phase transitions every 5 seconds.
     * Publishes a MarketStatusEvent when the phase changes.
     */
    @Scheduled(fixedRate = 5000)
    public void updateMarketPhase() {
        ZonedDateTime now = toExchangeTime(clock.instant());
        updateMarketPhase(now.toLocalDate(), now.toLocalTime());
    }

    /**
     * Testable version: determines the market phase for a given date and time.
     */
    public void updateMarketPhase(LocalDate date, LocalTime time) {
        MarketPhase newPhase = calculatePhase(date, time);
        MarketPhase previousPhase = currentPhase.getAndSet(newPhase);

        if (previousPhase != newPhase) {
            applicationEventPublisher.publishEvent(
                    new MarketStatusEvent(this, previousPhase, newPhase, LocalDateTime.of(date, time)));
            log.info("Market phase transition: {} -> {}", previousPhase, newPhase);
        }
    }

    public MarketPhase getCurrentPhase() {
        return currentPhase.get();
    }

    /**
     * Checks if a date is a non-trading day (weekend or full holiday).
     * Weekends (Saturday/Sunday) are always holidays.
     */
    public boolean isHoliday(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return true;
        }
        return holidayCalendarConfig.getHolidays().stream()
                .anyMatch(h -> h.getDate().equals(date) && h.getType() == HolidayType.FULL_HOLIDAY);
    }

    /** Returns true if the date has a Muhurat trading session (Diwali). */
    public boolean isMuhuratTrading(LocalDate date) {
        return holidayCalendarConfig.getHolidays().stream()
                .anyMatch(h -> h.getDate().equals(date) && h.getType() == HolidayType.MUHURAT_TRADING);
    }

    /**
     * Returns true if the date is a trading day.
     * A day is a trading day if it's not a holiday, OR if it has Muhurat trading.
     */
    public boolean isTradingDay(LocalDate date) {
        return !isHoliday(date) || isMuhuratTrading(date);
    }

    /** Returns the next trading day after the given date. */
    public LocalDate getNextTradingDay(LocalDate from) {
        LocalDate next = from.plusDays(1);
        while (!isTradingDay(next)) {
            next = next.plusDays(1);
        }
        return next;
    }

    /**
     * Determines the NSE market phase for a given date and time.
     */
    public MarketPhase calculatePhase(LocalDate date, LocalTime time) {
        if (!isTradingDay(date)) {
            return MarketPhase.CLOSED;
        }

        if (time.isBefore(MarketPhase.PRE_OPEN.getStartTime())) {
            return MarketPhase.CLOSED;
        }
        if (time.isBefore(MarketPhase.PRE_OPEN_ORDER_MATCHING.getStartTime())) {
            return MarketPhase.PRE_OPEN;
        }
        if (time.isBefore(MarketPhase.NORMAL.getStartTime())) {
            return MarketPhase.PRE_OPEN_ORDER_MATCHING;
        }
        if (time.isBefore(MarketPhase.CLOSING.getStartTime())) {
            return MarketPhase.NORMAL;
        }
        if (time.isBefore(MarketPhase.POST_CLOSE.getStartTime())) {
            return MarketPhase.CLOSING;
        }
        if (time.isBefore(MarketPhase.POST_CLOSE.getEndTime())) {
            return MarketPhase.POST_CLOSE;
        }

        return MarketPhase.CLOSED;
    }

    private ZonedDateTime toExchangeTime(Instant instant) {
        return instant.atZone(ZoneId.of(holidayCalendarConfig.getTimezone()));
    }
}
