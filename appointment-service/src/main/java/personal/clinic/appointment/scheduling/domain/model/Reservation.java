package personal.clinic.appointment.scheduling.domain.model;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Reservation Domain Model
 * 의사-환자 간 진료 예약 (불변)
 * <p>
 * 상태 전이: CONFIRMED -> CANCELLED.
 * 외부 동기화/알림 상태는 예약 확정 이후 별도 파이프라인이 기록한다.
 */
public record Reservation(
        Long id,
        String reservationId,
        String doctorId,
        String patientId,
        TimeInterval interval,
        ReservationStatus status,
        BookingMetadata metadata,
        ExternalSyncStatus externalSyncStatus,
        String externalEventId,
        NotificationStatus notificationStatus,
        LocalDateTime createdAt,
        LocalDateTime cancelledAt) {

    public Reservation {
        if (reservationId == null || reservationId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation ID cannot be blank");
        }
        if (doctorId == null || doctorId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Doctor ID cannot be blank");
        }
        if (patientId == null || patientId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Patient ID cannot be blank");
        }
        if (interval == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation interval cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation status cannot be null");
        }
        if (createdAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Creation time cannot be null");
        }
        metadata = metadata == null ? BookingMetadata.defaults() : metadata;
        externalSyncStatus = externalSyncStatus == null ? ExternalSyncStatus.PENDING : externalSyncStatus;
        notificationStatus = notificationStatus == null ? NotificationStatus.PENDING : notificationStatus;
    }

    /**
     * 확정 예약 생성 (A-xxxxxxxx 형식 ID 발급)
     */
    public static Reservation confirm(String doctorId, String patientId, TimeInterval interval,
                                      BookingMetadata metadata) {
        return new Reservation(
                null,
                "A-" + UUID.randomUUID().toString().substring(0, 8),
                doctorId,
                patientId,
                interval,
                ReservationStatus.CONFIRMED,
                metadata,
                ExternalSyncStatus.PENDING,
                null,
                NotificationStatus.PENDING,
                LocalDateTime.now(),
                null);
    }

    /**
     * 예약 취소 (CONFIRMED -> CANCELLED)
     */
    public Reservation cancel() {
        if (status != ReservationStatus.CONFIRMED) {
            throw new IllegalStateException(
                    String.format("Cannot cancel reservation in %s status. Reservation ID: %s", status, reservationId));
        }
        return new Reservation(id, reservationId, doctorId, patientId, interval, ReservationStatus.CANCELLED,
                metadata, externalSyncStatus, externalEventId, notificationStatus, createdAt, LocalDateTime.now());
    }

    public boolean isConfirmed() {
        return status == ReservationStatus.CONFIRMED;
    }

    public boolean isCancelled() {
        return status == ReservationStatus.CANCELLED;
    }

    /**
     * 확정 예약이면서 주어진 구간과 겹치는지 확인
     */
    public boolean blocks(TimeInterval other) {
        return isConfirmed() && interval.overlaps(other);
    }

    public boolean awaitsCalendarSync() {
        return externalSyncStatus == ExternalSyncStatus.PENDING;
    }

    public boolean awaitsNotification() {
        return notificationStatus == NotificationStatus.PENDING;
    }

    public PaymentStatus paymentStatus() {
        return metadata.paymentStatus();
    }
}
