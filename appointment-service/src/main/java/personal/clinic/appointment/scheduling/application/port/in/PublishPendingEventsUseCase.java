package personal.clinic.appointment.scheduling.application.port.in;

/**
 * Publish Pending Events UseCase (Input Port)
 * Outbox에 쌓인 예약 이벤트를 발행
 */
public interface PublishPendingEventsUseCase {

    /**
     * @return 발행에 성공한 이벤트 수
     */
    int publishPendingEvents();
}
