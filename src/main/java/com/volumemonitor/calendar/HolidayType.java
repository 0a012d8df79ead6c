package com.volumemonitor.calendar;

/**
 * Classifies the type of holiday on the NSE trading calendar.
 *
 * <p>FULL_HOLIDAY means no trading at all. MUHURAT_TRADING (Diwali) counts as a trading
 * day, so monitoring may run on it.
 */
public enum HolidayType {

    /** Full day holiday, no trading. */
    FULL_HOLIDAY,

    /** Special Muhurat trading session on Diwali. */
    MUHURAT_TRADING
}
