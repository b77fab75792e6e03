package personal.clinic.appointment.scheduling.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import personal.clinic.appointment.scheduling.domain.model.BookedAppointment;
import personal.clinic.appointment.scheduling.domain.model.ExternalSyncStatus;
import personal.clinic.appointment.scheduling.domain.model.NotificationStatus;
import personal.clinic.appointment.scheduling.domain.model.PaymentStatus;
import personal.clinic.appointment.scheduling.domain.model.Reservation;
import personal.clinic.appointment.scheduling.domain.model.ReservationDetails;
import personal.clinic.appointment.scheduling.domain.model.ReservationStatus;
import personal.clinic.appointment.scheduling.domain.model.Slot;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * 예약 생성/조회 응답 DTO
 * 시각은 진료 기준 오프셋으로 표시한다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReservationResponse(
        String reservationId,
        String doctorId,
        String doctorName,
        String specialty,
        String patientId,
        String patientName,
        LocalDate date,
        String time,
        OffsetDateTime startAt,
        OffsetDateTime endAt,
        ReservationStatus status,
        String appointmentType,
        String reason,
        BigDecimal consultationFee,
        PaymentStatus paymentStatus,
        ExternalSyncStatus externalSyncStatus,
        NotificationStatus notificationStatus,
        LocalDateTime createdAt,
        LocalDateTime cancelledAt
) {
    public static ReservationResponse from(BookedAppointment booked, ZoneOffset offset) {
        return of(booked.reservation(), booked.doctor().name(), booked.doctor().specialty(),
                booked.patient().name(), booked.doctor().consultationFee(), offset);
    }

    public static ReservationResponse from(ReservationDetails details, ZoneOffset offset) {
        return of(details.reservation(), details.doctorName(), details.specialty(),
                details.patientName(), null, offset);
    }

    private static ReservationResponse of(Reservation reservation, String doctorName, String specialty,
                                          String patientName, BigDecimal fee, ZoneOffset offset) {
        Slot slot = new Slot(reservation.interval().startAt(offset), reservation.interval().endAt(offset));
        return new ReservationResponse(
                reservation.reservationId(),
                reservation.doctorId(),
                doctorName,
                specialty,
                reservation.patientId(),
                patientName,
                slot.startAt().toLocalDate(),
                slot.label(),
                slot.startAt(),
                slot.endAt(),
                reservation.status(),
                reservation.metadata().appointmentType(),
                reservation.metadata().reason(),
                fee,
                reservation.paymentStatus(),
                reservation.externalSyncStatus(),
                reservation.notificationStatus(),
                reservation.createdAt(),
                reservation.cancelledAt()
        );
    }
}
