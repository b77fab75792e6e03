package personal.clinic.appointment.scheduling.adapter.in.web.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import personal.clinic.appointment.scheduling.application.port.in.BookSlotCommand;
import personal.clinic.appointment.scheduling.domain.model.BookingMetadata;

/**
 * 진료 예약 요청 DTO
 * 이메일/전화번호 중 최소 하나는 BookSlotCommand에서 검증한다.
 */
public record BookSlotRequest(
        @NotBlank(message = "doctorId is required")
        String doctorId,

        @NotBlank(message = "patientName is required")
        @Size(max = 100, message = "patientName must be at most 100 characters")
        String patientName,

        @Email(message = "patientEmail must be a valid email address")
        @Size(max = 120, message = "patientEmail must be at most 120 characters")
        String patientEmail,

        @Size(max = 30, message = "patientPhone must be at most 30 characters")
        String patientPhone,

        @NotBlank(message = "date is required")
        String date,

        @NotBlank(message = "timeSlot is required")
        String timeSlot,

        @Size(max = 255, message = "reason must be at most 255 characters")
        String reason,

        @Size(max = 40, message = "appointmentType must be at most 40 characters")
        String appointmentType,

        @Size(max = 80, message = "paymentOrderId must be at most 80 characters")
        String paymentOrderId,

        @Size(max = 40, message = "paymentMethod must be at most 40 characters")
        String paymentMethod
) {
    public BookSlotCommand toCommand() {
        return new BookSlotCommand(
                doctorId.trim(),
                patientName,
                patientEmail,
                patientPhone,
                date.trim(),
                timeSlot,
                new BookingMetadata(reason, appointmentType, paymentOrderId, paymentMethod));
    }
}
