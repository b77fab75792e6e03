package personal.clinic.appointment.scheduling.domain.exception;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

/**
 * Booking Lock Timeout Exception
 * 대기 시간 내에 의사 단위 예약 락을 얻지 못했을 때
 */
public class BookingLockTimeoutException extends BusinessException {
    public BookingLockTimeoutException(String doctorId, long waitMillis) {
        super(ErrorCode.BOOKING_LOCK_TIMEOUT,
                String.format("Could not acquire booking lock: doctorId=%s, waitMillis=%d", doctorId, waitMillis));
    }
}
