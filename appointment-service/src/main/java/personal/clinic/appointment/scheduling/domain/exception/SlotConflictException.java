package personal.clinic.appointment.scheduling.domain.exception;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

/**
 * Slot Conflict Exception
 * 요청 구간이 의사의 기존 확정 예약과 겹칠 때 (409 Conflict)
 */
public class SlotConflictException extends BusinessException {
    public SlotConflictException(String doctorId, String reason) {
        super(ErrorCode.SLOT_CONFLICT, String.format("Slot conflict: doctorId=%s, reason=%s", doctorId, reason));
    }
}
