package personal.clinic.appointment.scheduling.domain.model;

import java.time.LocalDateTime;

/**
 * Outbox Event Domain Model
 * 예약 트랜잭션과 함께 저장되고, 커밋 이후 릴레이가 Kafka로 발행한다.
 */
public record OutboxEvent(
        Long id,
        String aggregateType,
        String aggregateId,
        String eventType,
        String payload,
        OutboxEventStatus status,
        LocalDateTime createdAt,
        LocalDateTime publishedAt,
        int retryCount) {

    public static final int DEFAULT_MAX_RETRY_COUNT = 3;

    public enum OutboxEventStatus {
        PENDING,
        PUBLISHED,
        FAILED
    }

    public OutboxEvent markAsPublished() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                OutboxEventStatus.PUBLISHED, createdAt, LocalDateTime.now(), retryCount);
    }

    public OutboxEvent incrementRetryCount() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                status, createdAt, publishedAt, retryCount + 1);
    }

    public boolean retriesExhausted(int maxRetryCount) {
        return retryCount >= maxRetryCount;
    }

    public OutboxEvent markAsFailed() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                OutboxEventStatus.FAILED, createdAt, publishedAt, retryCount);
    }
}
