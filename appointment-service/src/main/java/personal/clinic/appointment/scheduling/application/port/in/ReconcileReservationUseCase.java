package personal.clinic.appointment.scheduling.application.port.in;

/**
 * Reconcile Reservation UseCase (Input Port)
 * 예약 확정 이후의 후속 처리 (캘린더 동기화, 확정 알림)
 * <p>
 * 응답 경로와 분리되어 실행되며, 어떤 실패도 예약 자체를 되돌리지 않는다.
 */
public interface ReconcileReservationUseCase {

    /**
     * 예약 확정 후속 처리
     * 각 단계는 해당 상태가 PENDING일 때만 한 번 수행된다.
     */
    void reconcileBooked(String reservationId);

    /**
     * 취소된 예약의 캘린더 일정 삭제
     */
    void withdrawCancelled(String reservationId);
}
