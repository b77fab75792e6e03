package personal.clinic.appointment.scheduling.domain.model;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

/**
 * Doctor Domain Model
 * 의사 정보와 요일별 진료 시간 (불변)
 *
 * @param calendarId 외부 캘린더 ID (없으면 캘린더 조회/동기화 생략)
 * @param timezone   캘린더 이벤트에 사용할 IANA 타임존 (없으면 기본 타임존)
 */
public record Doctor(
        Long id,
        String doctorId,
        String name,
        String email,
        String phone,
        String specialty,
        String qualification,
        Integer experienceYears,
        BigDecimal consultationFee,
        Double rating,
        String calendarId,
        String timezone,
        boolean active,
        Map<DayOfWeek, WorkingWindow> weeklyAvailability) {

    public Doctor {
        if (doctorId == null || doctorId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Doctor ID cannot be blank");
        }
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Doctor name cannot be blank");
        }
        weeklyAvailability = weeklyAvailability == null || weeklyAvailability.isEmpty()
                ? Map.of()
                : Map.copyOf(new EnumMap<>(weeklyAvailability));
    }

    /**
     * 해당 날짜 요일의 진료 시간대 (등록되지 않은 요일은 휴진)
     */
    public WorkingWindow windowOn(LocalDate date) {
        return weeklyAvailability.getOrDefault(date.getDayOfWeek(), WorkingWindow.closed());
    }

    public boolean hasCalendar() {
        return calendarId != null && !calendarId.isBlank();
    }

    public String timezoneOr(String defaultTimezone) {
        return timezone == null || timezone.isBlank() ? defaultTimezone : timezone;
    }
}
