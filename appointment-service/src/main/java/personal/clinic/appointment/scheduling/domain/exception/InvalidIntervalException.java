package personal.clinic.appointment.scheduling.domain.exception;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

/**
 * 날짜/시간대 파싱 실패 또는 시작이 종료보다 늦은 구간
 */
public class InvalidIntervalException extends BusinessException {
    public InvalidIntervalException(String detail) {
        super(ErrorCode.INVALID_INTERVAL, detail);
    }
}
