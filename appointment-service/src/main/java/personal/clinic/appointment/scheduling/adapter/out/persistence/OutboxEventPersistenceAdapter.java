package personal.clinic.appointment.scheduling.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.clinic.appointment.scheduling.application.port.out.OutboxEventRepository;
import personal.clinic.appointment.scheduling.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox Event Persistence Adapter
 * OutboxEventRepository 구현체
 */
@Component
@RequiredArgsConstructor
public class OutboxEventPersistenceAdapter implements OutboxEventRepository {

    private final JpaOutboxEventRepository jpaOutboxEventRepository;

    @Override
    public OutboxEvent save(OutboxEvent outboxEvent) {
        return jpaOutboxEventRepository.save(OutboxEventEntity.fromDomain(outboxEvent)).toDomain();
    }

    @Override
    public List<OutboxEvent> findPendingEvents(int maxRetryCount) {
        return jpaOutboxEventRepository.findByStatusAndRetryCountLessThanOrderByCreatedAtAsc(
                        OutboxEvent.OutboxEventStatus.PENDING,
                        maxRetryCount)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }
}
