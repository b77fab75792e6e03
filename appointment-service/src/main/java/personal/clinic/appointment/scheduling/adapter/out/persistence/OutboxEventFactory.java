package personal.clinic.appointment.scheduling.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.clinic.appointment.scheduling.domain.model.AppointmentEventType;
import personal.clinic.appointment.scheduling.domain.model.Reservation;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

/**
 * Outbox Event Factory (Adapter Layer)
 * Reservation을 OutboxEventEntity로 변환하는 팩토리
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxEventFactory {

    static final String AGGREGATE_TYPE = "RESERVATION";

    private final ObjectMapper objectMapper;

    /**
     * 예약 상태에 맞는 이벤트 생성 (CONFIRMED -> BOOKED, CANCELLED -> CANCELLED)
     */
    public OutboxEventEntity createAppointmentEvent(Reservation reservation) {
        AppointmentEventType eventType = AppointmentEventType.of(reservation.status());
        AppointmentEventPayload event = new AppointmentEventPayload(
                reservation.reservationId(),
                reservation.doctorId(),
                reservation.patientId(),
                reservation.interval().start().toString(),
                reservation.interval().end().toString(),
                reservation.status().name(),
                reservation.createdAt().toString());

        try {
            String payload = objectMapper.writeValueAsString(event);
            return OutboxEventEntity.create(AGGREGATE_TYPE, reservation.reservationId(), eventType.name(), payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to create outbox event: reservationId={}", reservation.reservationId(), e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to create outbox event", e);
        }
    }

    /**
     * Kafka 이벤트 DTO
     */
    public record AppointmentEventPayload(
            String reservationId,
            String doctorId,
            String patientId,
            String startAt,
            String endAt,
            String status,
            String createdAt) {
    }
}
