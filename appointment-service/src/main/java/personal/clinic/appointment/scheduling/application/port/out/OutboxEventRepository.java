package personal.clinic.appointment.scheduling.application.port.out;

import personal.clinic.appointment.scheduling.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox Event Repository (Output Port)
 * Transactional Outbox Pattern을 위한 이벤트 저장소 인터페이스
 */
public interface OutboxEventRepository {

    OutboxEvent save(OutboxEvent outboxEvent);

    /**
     * 발행 대기 중인 이벤트 조회 (생성 순)
     *
     * @return PENDING 상태이면서 재시도 한도 미만인 이벤트 목록
     */
    List<OutboxEvent> findPendingEvents(int maxRetryCount);
}
