package personal.clinic.appointment.scheduling.adapter.out.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.clinic.appointment.scheduling.adapter.out.persistence.JpaOutboxEventRepository;
import personal.clinic.appointment.scheduling.adapter.out.persistence.OutboxEventEntity;
import personal.clinic.appointment.scheduling.adapter.out.persistence.OutboxEventFactory;
import personal.clinic.appointment.scheduling.application.port.out.ReservationEventPort;
import personal.clinic.appointment.scheduling.domain.model.Reservation;

/**
 * Reservation Event Adapter
 * Outbox 테이블에 예약 이벤트를 기록하는 구현체
 * 호출자의 트랜잭션에 참여하므로 예약 저장과 이벤트 기록은 함께 커밋/롤백된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationEventAdapter implements ReservationEventPort {

    private final JpaOutboxEventRepository jpaOutboxEventRepository;
    private final OutboxEventFactory outboxEventFactory;

    @Override
    public void recordReservationEvent(Reservation reservation) {
        OutboxEventEntity outboxEvent = outboxEventFactory.createAppointmentEvent(reservation);
        jpaOutboxEventRepository.save(outboxEvent);
        log.debug("Reservation event recorded: reservationId={}, eventType={}",
                reservation.reservationId(), outboxEvent.getEventType());
    }
}
