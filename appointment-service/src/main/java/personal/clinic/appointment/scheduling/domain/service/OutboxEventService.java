package personal.clinic.appointment.scheduling.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.clinic.appointment.scheduling.application.port.in.PublishPendingEventsUseCase;
import personal.clinic.appointment.scheduling.application.port.out.OutboxEventRepository;
import personal.clinic.appointment.scheduling.application.port.out.ReservationEventPublisher;
import personal.clinic.appointment.scheduling.domain.model.AppointmentEventType;
import personal.clinic.appointment.scheduling.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox Event Service
 * 대기 중인 예약 이벤트를 발행 처리하는 도메인 서비스
 * 발행 실패 시 재시도 횟수를 올리고, 한도에 도달하면 FAILED로 전환한다.
 */
@Slf4j
@Service
public class OutboxEventService implements PublishPendingEventsUseCase {

    private final OutboxEventRepository outboxEventRepository;
    private final ReservationEventPublisher eventPublisher;
    private final int maxRetryCount;

    public OutboxEventService(OutboxEventRepository outboxEventRepository,
                              ReservationEventPublisher eventPublisher,
                              @Value("${appointment.outbox.max-retry-count:" + OutboxEvent.DEFAULT_MAX_RETRY_COUNT + "}")
                              int maxRetryCount) {
        this.outboxEventRepository = outboxEventRepository;
        this.eventPublisher = eventPublisher;
        this.maxRetryCount = maxRetryCount;
    }

    @Override
    @Transactional
    public int publishPendingEvents() {
        List<OutboxEvent> pendingEvents = outboxEventRepository.findPendingEvents(maxRetryCount);
        int publishedCount = 0;

        for (OutboxEvent event : pendingEvents) {
            try {
                String topic = AppointmentEventType.valueOf(event.eventType()).topic();

                // Key: reservationId (같은 예약의 이벤트 순서 보장)
                log.debug("Publishing event: id={}, type={}, topic={}", event.id(), event.eventType(), topic);
                eventPublisher.publishRaw(topic, event.aggregateId(), event.payload());

                outboxEventRepository.save(event.markAsPublished());
                publishedCount++;

            } catch (Exception e) {
                log.error("Failed to publish event: id={}, aggregateId={}", event.id(), event.aggregateId(), e);

                OutboxEvent retriedEvent = event.incrementRetryCount();
                if (retriedEvent.retriesExhausted(maxRetryCount)) {
                    log.error("Outbox event exceeded retry limit, marking FAILED: id={}, aggregateId={}",
                            event.id(), event.aggregateId());
                    retriedEvent = retriedEvent.markAsFailed();
                }
                outboxEventRepository.save(retriedEvent);
            }
        }
        return publishedCount;
    }
}
