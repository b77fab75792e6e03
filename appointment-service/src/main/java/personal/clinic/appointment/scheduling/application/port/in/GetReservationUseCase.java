package personal.clinic.appointment.scheduling.application.port.in;

import personal.clinic.appointment.scheduling.domain.model.ReservationDetails;

/**
 * Get Reservation UseCase (Input Port)
 */
public interface GetReservationUseCase {

    /**
     * @throws personal.clinic.appointment.scheduling.domain.exception.ReservationNotFoundException 예약이 없을 때
     */
    ReservationDetails getReservation(String reservationId);
}
