package personal.clinic.appointment.scheduling.domain.model;

import personal.clinic.appointment.scheduling.domain.exception.InvalidIntervalException;

import java.time.LocalTime;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 12시간제 시각 (예: "09:30 AM")
 * 시 1-12, 분 00-59, AM/PM 필수
 */
public record ClockTime(int hour, int minute, Meridiem meridiem) {

    private static final Pattern CLOCK_PATTERN =
            Pattern.compile("^(\\d{1,2}):(\\d{2})\\s*(AM|PM)$", Pattern.CASE_INSENSITIVE);

    public enum Meridiem {
        AM, PM
    }

    public ClockTime {
        if (hour < 1 || hour > 12) {
            throw new InvalidIntervalException(String.format("Hour must be between 1 and 12: hour=%d", hour));
        }
        if (minute < 0 || minute > 59) {
            throw new InvalidIntervalException(String.format("Minute must be between 0 and 59: minute=%d", minute));
        }
        if (meridiem == null) {
            throw new InvalidIntervalException("AM/PM marker is required");
        }
    }

    public static ClockTime parse(String text) {
        if (text == null) {
            throw new InvalidIntervalException("Time cannot be null");
        }
        Matcher matcher = CLOCK_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            throw new InvalidIntervalException(String.format("Unrecognized time format: '%s'", text));
        }
        return new ClockTime(
                Integer.parseInt(matcher.group(1)),
                Integer.parseInt(matcher.group(2)),
                Meridiem.valueOf(matcher.group(3).toUpperCase(Locale.ROOT)));
    }

    public static ClockTime from(LocalTime time) {
        int hour12 = time.getHour() % 12 == 0 ? 12 : time.getHour() % 12;
        Meridiem meridiem = time.getHour() < 12 ? Meridiem.AM : Meridiem.PM;
        return new ClockTime(hour12, time.getMinute(), meridiem);
    }

    public LocalTime toLocalTime() {
        int hour24 = hour % 12 + (meridiem == Meridiem.PM ? 12 : 0);
        return LocalTime.of(hour24, minute);
    }

    public String format() {
        return String.format("%02d:%02d %s", hour, minute, meridiem.name());
    }
}
