package personal.clinic.appointment.scheduling.domain.model;

/**
 * 예약 단건 조회 결과 (의사/환자 이름 포함)
 */
public record ReservationDetails(
        Reservation reservation,
        String doctorName,
        String specialty,
        String patientName) {
}
