package personal.clinic.appointment.scheduling.adapter.out.kafka;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import personal.clinic.appointment.scheduling.application.port.out.ReservationEventPublisher;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Appointment Kafka Publisher (Adapter Layer)
 * Outbox Service에 의해 호출되며, 브로커 ack를 받은 뒤에만 반환한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AppointmentKafkaPublisher implements ReservationEventPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 5;

    private final KafkaTemplate<String, String> kafkaTemplate;

    @Override
    public void publishRaw(String topic, String key, String payload) {
        log.debug("Publishing raw event: topic={}, key={}", topic, key);
        try {
            kafkaTemplate.send(topic, key, payload).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.debug("Raw event published: topic={}, key={}", topic, key);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.EXTERNAL_SERVICE_ERROR,
                    String.format("Kafka publish interrupted: topic=%s, key=%s", topic, key), e);

        } catch (ExecutionException | TimeoutException e) {
            throw new BusinessException(ErrorCode.EXTERNAL_SERVICE_ERROR,
                    String.format("Kafka publish failed: topic=%s, key=%s", topic, key), e);
        }
    }
}
