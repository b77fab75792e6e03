package personal.clinic.appointment.scheduling.domain.model;

/**
 * Reservation Status
 * CONFIRMED 예약만 슬롯을 점유한다.
 */
public enum ReservationStatus {
    CONFIRMED,
    CANCELLED
}
