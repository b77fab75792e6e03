package personal.clinic.appointment.scheduling.domain.model;

import personal.clinic.appointment.scheduling.domain.exception.InvalidIntervalException;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * 예약 요청의 시간대 문자열
 * <p>
 * 허용 형식:
 * <ul>
 *   <li>{@code "09:00 AM"} - 시작 시각만 지정, 길이는 기본 슬롯 길이</li>
 *   <li>{@code "09:00 AM - 09:30 AM"} - 시작과 종료 지정</li>
 * </ul>
 * 종료가 "12:00 AM"이면 다음 날 자정으로 해석한다.
 *
 * @param start 시작 시각
 * @param end   종료 시각 (단일 시각 형식이면 null)
 */
public record RequestedTimeSlot(ClockTime start, ClockTime end) {

    private static final String RANGE_SEPARATOR = "\\s*-\\s*";

    public RequestedTimeSlot {
        if (start == null) {
            throw new InvalidIntervalException("Time slot start cannot be null");
        }
    }

    public static RequestedTimeSlot parse(String timeSlot) {
        if (timeSlot == null || timeSlot.isBlank()) {
            throw new InvalidIntervalException("Time slot cannot be blank");
        }
        String[] parts = timeSlot.trim().split(RANGE_SEPARATOR, -1);
        return switch (parts.length) {
            case 1 -> new RequestedTimeSlot(ClockTime.parse(parts[0]), null);
            case 2 -> new RequestedTimeSlot(ClockTime.parse(parts[0]), ClockTime.parse(parts[1]));
            default -> throw new InvalidIntervalException(
                    String.format("Unrecognized time slot format: '%s'", timeSlot));
        };
    }

    /**
     * 날짜와 오프셋을 적용하여 절대 구간으로 변환
     *
     * @throws InvalidIntervalException 종료가 시작보다 늦지 않을 때
     */
    public TimeInterval resolve(LocalDate date, ZoneOffset offset, int defaultMinutes) {
        OffsetDateTime startAt = date.atTime(start.toLocalTime()).atOffset(offset);
        if (end == null) {
            return TimeInterval.of(startAt, startAt.plusMinutes(defaultMinutes));
        }

        LocalTime endTime = end.toLocalTime();
        OffsetDateTime endAt = endTime.equals(LocalTime.MIDNIGHT)
                ? date.plusDays(1).atStartOfDay().atOffset(offset)
                : date.atTime(endTime).atOffset(offset);
        return TimeInterval.of(startAt, endAt);
    }
}
