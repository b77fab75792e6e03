package personal.clinic.appointment.scheduling.domain.exception;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

public class DoctorNotFoundException extends BusinessException {
    public DoctorNotFoundException(String doctorId) {
        super(ErrorCode.DOCTOR_NOT_FOUND, String.format("Doctor not found: doctorId=%s", doctorId));
    }
}
