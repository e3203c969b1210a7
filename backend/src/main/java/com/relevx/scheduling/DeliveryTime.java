package com.relevx.scheduling;

import java.time.LocalTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing of the HH:MM delivery time (24-hour, any minute value, e.g. "09:15", "23:42").
 */
public final class DeliveryTime {

    private static final Pattern HH_MM = Pattern.compile("^([01]?\\d|2[0-3]):([0-5]\\d)$");

    private DeliveryTime() {
    }

    public static boolean isValid(String value) {
        return value != null && HH_MM.matcher(value.trim()).matches();
    }

    /**
     * @throws IllegalArgumentException if the value is not HH:MM
     */
    public static LocalTime parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Delivery time is required");
        }
        Matcher m = HH_MM.matcher(value.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Delivery time must be HH:MM: " + value);
        }
        return LocalTime.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }
}
