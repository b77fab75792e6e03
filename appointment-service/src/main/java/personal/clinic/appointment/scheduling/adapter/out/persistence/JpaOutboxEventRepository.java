package personal.clinic.appointment.scheduling.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import personal.clinic.appointment.scheduling.domain.model.OutboxEvent;

import java.util.List;

public interface JpaOutboxEventRepository extends JpaRepository<OutboxEventEntity, Long> {

    List<OutboxEventEntity> findByStatusAndRetryCountLessThanOrderByCreatedAtAsc(
            OutboxEvent.OutboxEventStatus status, int retryCount);

    List<OutboxEventEntity> findByAggregateIdOrderByCreatedAtAsc(String aggregateId);
}
