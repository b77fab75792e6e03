package personal.clinic.appointment.scheduling.domain.model;

/**
 * 예약 확정 결과 (예약 + 의사 + 환자)
 */
public record BookedAppointment(Reservation reservation, Doctor doctor, Patient patient) {
}
