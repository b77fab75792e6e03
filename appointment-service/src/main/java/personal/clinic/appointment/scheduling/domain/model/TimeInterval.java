package personal.clinic.appointment.scheduling.domain.model;

import personal.clinic.appointment.scheduling.domain.exception.InvalidIntervalException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Time Interval Domain Model
 * 반개구간 [start, end) 형태의 절대 시간 구간 (불변)
 * <p>
 * 두 구간은 {@code a.start < b.end && b.start < a.end} 일 때만 겹친다.
 * 따라서 끝과 시작이 맞닿은 구간(09:30 종료 / 09:30 시작)은 충돌이 아니다.
 */
public record TimeInterval(Instant start, Instant end) {

    public TimeInterval {
        if (start == null || end == null) {
            throw new InvalidIntervalException("Interval bounds cannot be null");
        }
        if (!start.isBefore(end)) {
            throw new InvalidIntervalException(
                    String.format("Interval start must be before end: start=%s, end=%s", start, end));
        }
    }

    public static TimeInterval of(OffsetDateTime start, OffsetDateTime end) {
        if (start == null || end == null) {
            throw new InvalidIntervalException("Interval bounds cannot be null");
        }
        return new TimeInterval(start.toInstant(), end.toInstant());
    }

    /**
     * 해당 날짜의 하루 전체 구간 [date 00:00, date+1 00:00)
     */
    public static TimeInterval ofDay(LocalDate date, ZoneOffset offset) {
        OffsetDateTime dayStart = date.atStartOfDay().atOffset(offset);
        return of(dayStart, dayStart.plusDays(1));
    }

    public boolean overlaps(TimeInterval other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public boolean contains(TimeInterval other) {
        return !other.start.isBefore(start) && !other.end.isAfter(end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public OffsetDateTime startAt(ZoneOffset offset) {
        return start.atOffset(offset);
    }

    public OffsetDateTime endAt(ZoneOffset offset) {
        return end.atOffset(offset);
    }
}
