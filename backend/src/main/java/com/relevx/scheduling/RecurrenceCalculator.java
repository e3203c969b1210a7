package com.relevx.scheduling;

import com.relevx.domain.Frequency;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Computes the next execution instant of a recurring project.
 * <p>
 * The candidate is built from the local date in the project's timezone and the delivery time; it is placed on the
 * requested weekday or (clamped) day of month, then advanced period by period until it lies strictly after now.
 * Local date/time arithmetic is converted to an instant only through {@link ZonedDateTime#of}, so DST gaps shift
 * forward and overlaps resolve to the earlier offset.
 */
@Component
@RequiredArgsConstructor
public class RecurrenceCalculator {

    private final Clock clock;

    public Instant computeNextRun(ProjectSchedule schedule, boolean forceAdvance) {
        return computeNextRun(schedule.frequency(), schedule.deliveryTime(), schedule.timezone(),
                schedule.dayOfWeek(), schedule.dayOfMonth(), forceAdvance);
    }

    public Instant computeNextRun(Frequency frequency, String deliveryTime, String timezone,
                                  Integer dayOfWeek, Integer dayOfMonth) {
        return computeNextRun(frequency, deliveryTime, timezone, dayOfWeek, dayOfMonth, false);
    }

    /**
     * @param dayOfWeek    0-6, Sunday first; used for WEEKLY
     * @param dayOfMonth   1-31; used for MONTHLY, clamped to the month's last day
     * @param forceAdvance skip the computed occurrence and return the following one
     * @return next run instant, strictly after the clock's current instant
     */
    public Instant computeNextRun(Frequency frequency, String deliveryTime, String timezone,
                                  Integer dayOfWeek, Integer dayOfMonth, boolean forceAdvance) {
        ZoneId zone = ZoneId.of(timezone);
        LocalTime time = DeliveryTime.parse(deliveryTime);
        Instant now = clock.instant();
        ZonedDateTime nowLocal = now.atZone(zone);

        LocalDate date = nowLocal.toLocalDate();
        int anchorDay = dayOfMonth != null ? dayOfMonth : date.getDayOfMonth();

        if (frequency == Frequency.WEEKLY && dayOfWeek != null) {
            int daysUntilTarget = dayOfWeek - sundayFirstIndex(date.getDayOfWeek());
            if (daysUntilTarget < 0 || (daysUntilTarget == 0 && !isAfter(date, time, zone, now))) {
                daysUntilTarget += 7;
            }
            date = date.plusDays(daysUntilTarget);
        } else if (frequency == Frequency.MONTHLY && dayOfMonth != null) {
            int currentDay = date.getDayOfMonth();
            int targetDay = Math.min(dayOfMonth, date.lengthOfMonth());
            if (currentDay < targetDay || (currentDay == targetDay && isAfter(date, time, zone, now))) {
                date = date.withDayOfMonth(targetDay);
            } else {
                YearMonth next = YearMonth.from(date).plusMonths(1);
                date = next.atDay(Math.min(dayOfMonth, next.lengthOfMonth()));
            }
        }

        while (!isAfter(date, time, zone, now)) {
            date = addPeriod(date, frequency, anchorDay);
        }
        if (forceAdvance) {
            date = addPeriod(date, frequency, anchorDay);
        }
        return ZonedDateTime.of(date, time, zone).toInstant();
    }

    /**
     * One frequency period later. Monthly steps re-clamp to the anchor day so day 31 returns to 31 after February.
     */
    static LocalDate addPeriod(LocalDate date, Frequency frequency, int anchorDay) {
        return switch (frequency) {
            case DAILY -> date.plusDays(1);
            case WEEKLY -> date.plusWeeks(1);
            case MONTHLY -> {
                YearMonth next = YearMonth.from(date).plusMonths(1);
                yield next.atDay(Math.min(anchorDay, next.lengthOfMonth()));
            }
        };
    }

    /** Sunday = 0 ... Saturday = 6. */
    public static int sundayFirstIndex(DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % 7;
    }

    private static boolean isAfter(LocalDate date, LocalTime time, ZoneId zone, Instant now) {
        return ZonedDateTime.of(date, time, zone).toInstant().isAfter(now);
    }
}
