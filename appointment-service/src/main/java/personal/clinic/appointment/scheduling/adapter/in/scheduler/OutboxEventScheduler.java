package personal.clinic.appointment.scheduling.adapter.in.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.clinic.appointment.scheduling.application.port.in.PublishPendingEventsUseCase;

/**
 * Outbox Event Scheduler (Driving Adapter)
 * 주기적으로 OutboxEventService를 호출하여 PENDING 상태의 예약 이벤트를 발행
 * <p>
 * appointment.outbox.enabled=false 이면 등록되지 않는다 (테스트 환경).
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "appointment.outbox", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OutboxEventScheduler {

    private final PublishPendingEventsUseCase publishPendingEventsUseCase;

    /**
     * 이전 실행 완료 후 500ms 간격
     */
    @Scheduled(fixedDelayString = "${appointment.outbox.poll-interval-ms:500}")
    public void schedulePublishing() {
        int publishedCount = publishPendingEventsUseCase.publishPendingEvents();
        if (publishedCount > 0) {
            log.debug("Scheduled publishing completed. Count: {}", publishedCount);
        }
    }
}
