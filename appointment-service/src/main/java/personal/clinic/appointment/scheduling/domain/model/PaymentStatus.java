package personal.clinic.appointment.scheduling.domain.model;

public enum PaymentStatus {
    PENDING,
    UNPAID
}
