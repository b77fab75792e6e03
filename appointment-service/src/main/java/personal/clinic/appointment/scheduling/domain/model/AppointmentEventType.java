package personal.clinic.appointment.scheduling.domain.model;

/**
 * 예약 도메인 이벤트 종류와 발행 토픽
 */
public enum AppointmentEventType {
    APPOINTMENT_BOOKED("appointment.booked"),
    APPOINTMENT_CANCELLED("appointment.cancelled");

    private final String topic;

    AppointmentEventType(String topic) {
        this.topic = topic;
    }

    public String topic() {
        return topic;
    }

    public static AppointmentEventType of(ReservationStatus status) {
        return switch (status) {
            case CONFIRMED -> APPOINTMENT_BOOKED;
            case CANCELLED -> APPOINTMENT_CANCELLED;
        };
    }
}
