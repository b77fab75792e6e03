package personal.clinic.appointment.scheduling.application.port.in;

import personal.clinic.appointment.scheduling.domain.exception.PatientContactRequiredException;
import personal.clinic.appointment.scheduling.domain.model.BookingMetadata;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

/**
 * Book Slot Command
 * 진료 예약 커맨드
 *
 * @param date     진료 날짜 (YYYY-MM-DD)
 * @param timeSlot 시간대 ("09:00 AM" 또는 "09:00 AM - 09:30 AM")
 */
public record BookSlotCommand(
        String doctorId,
        String patientName,
        String patientEmail,
        String patientPhone,
        String date,
        String timeSlot,
        BookingMetadata metadata) {

    public static final int MAX_PATIENT_NAME_LENGTH = 100;
    public static final int MAX_PATIENT_EMAIL_LENGTH = 120;
    public static final int MAX_PATIENT_PHONE_LENGTH = 30;

    public BookSlotCommand {
        if (doctorId == null || doctorId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Doctor ID cannot be blank");
        }
        if (patientName == null || patientName.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Patient name cannot be blank");
        }
        if (date == null || date.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Date cannot be blank");
        }
        if (timeSlot == null || timeSlot.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Time slot cannot be blank");
        }
        if (isBlank(patientEmail) && isBlank(patientPhone)) {
            throw new PatientContactRequiredException();
        }
        requireMaxLength("patientName", patientName, MAX_PATIENT_NAME_LENGTH);
        requireMaxLength("patientEmail", patientEmail, MAX_PATIENT_EMAIL_LENGTH);
        requireMaxLength("patientPhone", patientPhone, MAX_PATIENT_PHONE_LENGTH);
        metadata = metadata == null ? BookingMetadata.defaults() : metadata;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static void requireMaxLength(String field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    field + " must be at most " + maxLength + " characters");
        }
    }
}
