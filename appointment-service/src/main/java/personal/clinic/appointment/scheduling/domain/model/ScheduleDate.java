package personal.clinic.appointment.scheduling.domain.model;

import personal.clinic.appointment.scheduling.domain.exception.InvalidIntervalException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * 진료 날짜 문자열(YYYY-MM-DD) 파싱
 */
public final class ScheduleDate {

    private ScheduleDate() {
    }

    public static LocalDate parse(String date) {
        if (date == null || date.isBlank()) {
            throw new InvalidIntervalException("Date cannot be blank");
        }
        try {
            return LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidIntervalException(String.format("Date must be in YYYY-MM-DD format: '%s'", date));
        }
    }
}
