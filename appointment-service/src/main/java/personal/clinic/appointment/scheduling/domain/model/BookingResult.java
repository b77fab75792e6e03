package personal.clinic.appointment.scheduling.domain.model;

/**
 * 예약 트랜잭션 결과
 * 충돌은 예외가 아닌 값으로 반환하고, 애플리케이션 경계에서 409로 변환한다.
 */
public record BookingResult(boolean booked, Reservation reservation, Patient patient, String conflictReason) {

    public static BookingResult booked(Reservation reservation, Patient patient) {
        return new BookingResult(true, reservation, patient, null);
    }

    public static BookingResult conflict(String reason) {
        return new BookingResult(false, null, null, reason);
    }
}
