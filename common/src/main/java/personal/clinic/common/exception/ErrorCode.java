package personal.clinic.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "Invalid input."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C002", "The requested resource was not found."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C003", "An internal server error occurred."),

    // Scheduling Domain (Sxxx)
    INVALID_INTERVAL(HttpStatus.BAD_REQUEST, "S001", "Invalid date or time slot."),
    DOCTOR_NOT_FOUND(HttpStatus.NOT_FOUND, "S002", "Doctor not found."),
    RESERVATION_NOT_FOUND(HttpStatus.NOT_FOUND, "S003", "Appointment not found."),
    SLOT_CONFLICT(HttpStatus.CONFLICT, "S004", "This time slot is no longer available."),
    BOOKING_LOCK_TIMEOUT(HttpStatus.CONFLICT, "S005", "The doctor's schedule is busy. Please try again."),

    // Patient Domain (Pxxx)
    PATIENT_CONTACT_REQUIRED(HttpStatus.BAD_REQUEST, "P001", "Either patient email or phone is required."),

    // External Service (Exxx)
    EXTERNAL_SERVICE_ERROR(HttpStatus.SERVICE_UNAVAILABLE, "E001", "An external service error occurred."),
    EXTERNAL_SERVICE_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "E002", "An external service timed out.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
