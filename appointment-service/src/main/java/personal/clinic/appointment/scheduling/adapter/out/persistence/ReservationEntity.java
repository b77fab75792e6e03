package personal.clinic.appointment.scheduling.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.clinic.appointment.scheduling.domain.model.BookingMetadata;
import personal.clinic.appointment.scheduling.domain.model.ExternalSyncStatus;
import personal.clinic.appointment.scheduling.domain.model.NotificationStatus;
import personal.clinic.appointment.scheduling.domain.model.PaymentStatus;
import personal.clinic.appointment.scheduling.domain.model.Reservation;
import personal.clinic.appointment.scheduling.domain.model.ReservationStatus;
import personal.clinic.appointment.scheduling.domain.model.TimeInterval;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Reservation JPA Entity
 * 예약 테이블 매핑 (구간은 UTC Instant로 저장)
 */
@Entity
@Table(name = "reservations",
        uniqueConstraints = @UniqueConstraint(name = "uk_reservation_id", columnNames = "reservation_id"),
        indexes = {
                @Index(name = "idx_doctor_status_start", columnList = "doctor_id, status, start_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReservationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "reservation_id", nullable = false, length = 20)
    private String reservationId;

    @Column(name = "doctor_id", nullable = false, length = 40)
    private String doctorId;

    @Column(name = "patient_id", nullable = false, length = 20)
    private String patientId;

    @Column(name = "start_at", nullable = false)
    private Instant startAt;

    @Column(name = "end_at", nullable = false)
    private Instant endAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReservationStatus status;

    @Column(length = 255)
    private String reason;

    @Column(name = "appointment_type", length = 40)
    private String appointmentType;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(name = "payment_order_id", length = 80)
    private String paymentOrderId;

    @Column(name = "payment_method", length = 40)
    private String paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "external_sync_status", nullable = false, length = 20)
    private ExternalSyncStatus externalSyncStatus;

    @Column(name = "external_event_id", length = 200)
    private String externalEventId;

    @Enumerated(EnumType.STRING)
    @Column(name = "notification_status", nullable = false, length = 20)
    private NotificationStatus notificationStatus;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    public static ReservationEntity fromDomain(Reservation reservation) {
        ReservationEntity entity = new ReservationEntity();
        entity.id = reservation.id();
        entity.reservationId = reservation.reservationId();
        entity.doctorId = reservation.doctorId();
        entity.patientId = reservation.patientId();
        entity.startAt = reservation.interval().start();
        entity.endAt = reservation.interval().end();
        entity.status = reservation.status();
        entity.reason = reservation.metadata().reason();
        entity.appointmentType = reservation.metadata().appointmentType();
        entity.paymentStatus = reservation.paymentStatus();
        entity.paymentOrderId = reservation.metadata().paymentOrderId();
        entity.paymentMethod = reservation.metadata().paymentMethod();
        entity.externalSyncStatus = reservation.externalSyncStatus();
        entity.externalEventId = reservation.externalEventId();
        entity.notificationStatus = reservation.notificationStatus();
        entity.createdAt = reservation.createdAt();
        entity.cancelledAt = reservation.cancelledAt();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public Reservation toDomain() {
        return new Reservation(
                id,
                reservationId,
                doctorId,
                patientId,
                new TimeInterval(startAt, endAt),
                status,
                new BookingMetadata(reason, appointmentType, paymentOrderId, paymentMethod),
                externalSyncStatus,
                externalEventId,
                notificationStatus,
                createdAt,
                cancelledAt);
    }
}
