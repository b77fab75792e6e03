package personal.clinic.appointment.scheduling.domain.model;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

/**
 * 예약 부가 정보 (진료 사유, 진료 형태, 결제 정보)
 * 사유와 형태가 비어 있으면 기본값을 사용한다.
 * 길이 제한을 넘는 값은 저장 전에 INVALID_INPUT으로 거절한다.
 */
public record BookingMetadata(
        String reason,
        String appointmentType,
        String paymentOrderId,
        String paymentMethod) {

    public static final String DEFAULT_REASON = "General consultation";
    public static final String DEFAULT_APPOINTMENT_TYPE = "In-Person";

    public static final int MAX_REASON_LENGTH = 255;
    public static final int MAX_APPOINTMENT_TYPE_LENGTH = 40;
    public static final int MAX_PAYMENT_ORDER_ID_LENGTH = 80;
    public static final int MAX_PAYMENT_METHOD_LENGTH = 40;

    public BookingMetadata {
        reason = isBlank(reason) ? DEFAULT_REASON : reason.trim();
        appointmentType = isBlank(appointmentType) ? DEFAULT_APPOINTMENT_TYPE : appointmentType.trim();
        paymentOrderId = isBlank(paymentOrderId) ? null : paymentOrderId.trim();
        paymentMethod = isBlank(paymentMethod) ? null : paymentMethod.trim();

        requireMaxLength("reason", reason, MAX_REASON_LENGTH);
        requireMaxLength("appointmentType", appointmentType, MAX_APPOINTMENT_TYPE_LENGTH);
        requireMaxLength("paymentOrderId", paymentOrderId, MAX_PAYMENT_ORDER_ID_LENGTH);
        requireMaxLength("paymentMethod", paymentMethod, MAX_PAYMENT_METHOD_LENGTH);
    }

    public static BookingMetadata defaults() {
        return new BookingMetadata(null, null, null, null);
    }

    /**
     * 결제 주문이 있으면 결제 대기, 없으면 미결제
     */
    public PaymentStatus paymentStatus() {
        return paymentOrderId != null ? PaymentStatus.PENDING : PaymentStatus.UNPAID;
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
