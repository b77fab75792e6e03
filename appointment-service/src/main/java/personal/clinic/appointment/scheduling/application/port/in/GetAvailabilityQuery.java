package personal.clinic.appointment.scheduling.application.port.in;

import personal.clinic.appointment.scheduling.domain.model.ScheduleDate;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Get Availability Query
 */
public record GetAvailabilityQuery(String doctorId, LocalDate date) {

    public GetAvailabilityQuery {
        if (doctorId == null || doctorId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Doctor ID cannot be blank");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Date cannot be null");
        }
    }

    /**
     * @throws personal.clinic.appointment.scheduling.domain.exception.InvalidIntervalException 날짜 형식이 잘못된 경우
     */
    public static GetAvailabilityQuery of(String doctorId, String date) {
        return new GetAvailabilityQuery(doctorId, ScheduleDate.parse(date));
    }
}
