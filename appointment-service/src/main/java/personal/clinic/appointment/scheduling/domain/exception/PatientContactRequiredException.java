package personal.clinic.appointment.scheduling.domain.exception;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

public class PatientContactRequiredException extends BusinessException {
    public PatientContactRequiredException() {
        super(ErrorCode.PATIENT_CONTACT_REQUIRED, "Patient email or phone must be provided");
    }
}
