package personal.clinic.appointment.scheduling.adapter.in.kafka;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;
import personal.clinic.appointment.scheduling.application.port.in.ReconcileReservationUseCase;

/**
 * Appointment Event Listener (Driving Adapter)
 * Outbox 릴레이가 발행한 예약 이벤트를 받아 후속 처리를 실행한다.
 * <p>
 * 메시지 Key는 reservationId. 같은 이벤트가 다시 전달되어도
 * 후속 처리는 PENDING 상태에서만 동작하므로 결과가 달라지지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AppointmentEventListener {

    static final String BOOKED_TOPIC = "appointment.booked";
    static final String CANCELLED_TOPIC = "appointment.cancelled";

    private final ReconcileReservationUseCase reconcileReservationUseCase;

    @KafkaListener(
            topics = BOOKED_TOPIC,
            groupId = "${appointment.kafka.consumer-group:appointment-reconciliation}",
            autoStartup = "${appointment.kafka.listener.auto-startup:true}")
    public void onBooked(ConsumerRecord<String, String> record) {
        String reservationId = record.key();
        if (reservationId == null || reservationId.isBlank()) {
            log.warn("Ignoring booked event without key: topic={}, offset={}", record.topic(), record.offset());
            return;
        }
        log.info("Appointment booked event received: reservationId={}, offset={}", reservationId, record.offset());
        reconcileReservationUseCase.reconcileBooked(reservationId);
    }

    @KafkaListener(
            topics = CANCELLED_TOPIC,
            groupId = "${appointment.kafka.consumer-group:appointment-reconciliation}",
            autoStartup = "${appointment.kafka.listener.auto-startup:true}")
    public void onCancelled(ConsumerRecord<String, String> record) {
        String reservationId = record.key();
        if (reservationId == null || reservationId.isBlank()) {
            log.warn("Ignoring cancelled event without key: topic={}, offset={}", record.topic(), record.offset());
            return;
        }
        log.info("Appointment cancelled event received: reservationId={}, offset={}", reservationId, record.offset());
        reconcileReservationUseCase.withdrawCancelled(reservationId);
    }
}
