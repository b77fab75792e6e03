package personal.clinic.appointment.scheduling.domain.exception;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

/**
 * Calendar Unavailable Exception
 * 외부 캘린더 API 호출 실패 (5xx, 타임아웃, Circuit Open)
 */
public class CalendarUnavailableException extends BusinessException {
    public CalendarUnavailableException(String detail) {
        super(ErrorCode.EXTERNAL_SERVICE_ERROR, detail);
    }

    public CalendarUnavailableException(String detail, Throwable cause) {
        super(ErrorCode.EXTERNAL_SERVICE_ERROR, detail, cause);
    }
}
