package personal.clinic.appointment.scheduling.application.port.out;

import personal.clinic.appointment.scheduling.domain.model.Reservation;

/**
 * Reservation Event Port (Output Port)
 * 예약 상태 변경 이벤트를 현재 트랜잭션에 기록한다.
 */
public interface ReservationEventPort {

    void recordReservationEvent(Reservation reservation);
}
