package personal.clinic.appointment.scheduling.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 예약 확정 알림 내용
 */
public record ConfirmationNotice(
        String recipient,
        String reservationId,
        String patientName,
        String doctorName,
        String specialty,
        LocalDate date,
        String timeLabel,
        String appointmentType,
        String reason,
        BigDecimal consultationFee,
        String calendarLink) {
}
