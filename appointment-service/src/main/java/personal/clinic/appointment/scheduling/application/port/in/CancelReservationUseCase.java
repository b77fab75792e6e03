package personal.clinic.appointment.scheduling.application.port.in;

import personal.clinic.appointment.scheduling.domain.model.CancellationResult;

/**
 * Cancel Reservation UseCase (Input Port)
 */
public interface CancelReservationUseCase {

    /**
     * 예약 취소
     * 이미 취소된 예약은 상태 변경 없이 성공으로 응답한다.
     *
     * @throws personal.clinic.appointment.scheduling.domain.exception.ReservationNotFoundException 예약이 없을 때
     */
    CancellationResult cancel(String reservationId);
}
