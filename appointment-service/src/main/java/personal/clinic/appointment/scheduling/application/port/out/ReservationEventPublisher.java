package personal.clinic.appointment.scheduling.application.port.out;

/**
 * Reservation Event Publisher (Output Port)
 * Outbox에 기록된 이벤트를 메시지 브로커로 발행
 */
public interface ReservationEventPublisher {

    /**
     * 직렬화된 이벤트 발행
     * 브로커가 수신을 확인할 때까지 기다리며, 실패 시 예외를 던진다.
     *
     * @param topic   토픽
     * @param key     파티션 키 (reservationId)
     * @param payload JSON 페이로드
     */
    void publishRaw(String topic, String key, String payload);
}
