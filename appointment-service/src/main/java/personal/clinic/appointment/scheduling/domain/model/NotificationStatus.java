package personal.clinic.appointment.scheduling.domain.model;

public enum NotificationStatus {
    PENDING,
    SENT,
    SKIPPED,
    FAILED
}
