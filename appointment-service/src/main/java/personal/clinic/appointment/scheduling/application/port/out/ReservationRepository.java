package personal.clinic.appointment.scheduling.application.port.out;

import personal.clinic.appointment.scheduling.domain.model.ExternalSyncStatus;
import personal.clinic.appointment.scheduling.domain.model.NotificationStatus;
import personal.clinic.appointment.scheduling.domain.model.Reservation;
import personal.clinic.appointment.scheduling.domain.model.TimeInterval;

import java.util.List;
import java.util.Optional;

/**
 * Reservation Repository (Output Port)
 */
public interface ReservationRepository {

    /**
     * 예약 저장
     * 저장과 같은 트랜잭션에서 상태에 맞는 도메인 이벤트가 Outbox에 기록된다.
     */
    Reservation save(Reservation reservation);

    Optional<Reservation> findByReservationId(String reservationId);

    /**
     * 취소 처리를 위한 배타 락 조회
     */
    Optional<Reservation> findByReservationIdForUpdate(String reservationId);

    /**
     * 주어진 구간과 겹치는 의사의 CONFIRMED 예약 조회 (시작 시각 오름차순)
     */
    List<Reservation> findConfirmedOverlapping(String doctorId, TimeInterval range);

    /**
     * 캘린더 동기화 결과 기록
     * 현재 상태가 PENDING일 때만 반영된다.
     *
     * @return 반영되었으면 true
     */
    boolean recordCalendarSync(String reservationId, ExternalSyncStatus status, String externalEventId);

    /**
     * 알림 발송 결과 기록
     * 현재 상태가 PENDING일 때만 반영된다.
     *
     * @return 반영되었으면 true
     */
    boolean recordNotification(String reservationId, NotificationStatus status);
}
