package personal.clinic.appointment.scheduling.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.clinic.appointment.scheduling.application.port.out.OutboxEventRepository;
import personal.clinic.appointment.scheduling.application.port.out.ReservationEventPublisher;
import personal.clinic.appointment.scheduling.domain.model.OutboxEvent;
import personal.clinic.appointment.scheduling.domain.model.OutboxEvent.OutboxEventStatus;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutboxEventService 단위 테스트")
class OutboxEventServiceTest {

    @Mock
    private OutboxEventRepository outboxEventRepository;
    @Mock
    private ReservationEventPublisher eventPublisher;

    private OutboxEventService outboxEventService;

    @BeforeEach
    void setUp() {
        outboxEventService = new OutboxEventService(outboxEventRepository, eventPublisher, 3);
    }

    @Test
    @DisplayName("예약 이벤트를 토픽에 발행하고 PUBLISHED로 바꾼다")
    void publishesBookedEvent() {
        // given
        OutboxEvent event = pending(1L, "A-11111111", "APPOINTMENT_BOOKED", 0);
        given(outboxEventRepository.findPendingEvents(3)).willReturn(List.of(event));

        // when
        int published = outboxEventService.publishPendingEvents();

        // then
        assertThat(published).isEqualTo(1);
        verify(eventPublisher).publishRaw("appointment.booked", "A-11111111", "{}");
        ArgumentCaptor<OutboxEvent> saved = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxEventRepository).save(saved.capture());
        assertThat(saved.getValue().status()).isEqualTo(OutboxEventStatus.PUBLISHED);
        assertThat(saved.getValue().publishedAt()).isNotNull();
    }

    @Test
    @DisplayName("발행 실패 시 재시도 횟수만 올리고 PENDING을 유지한다")
    void incrementsRetryOnFailure() {
        // given
        OutboxEvent event = pending(2L, "A-22222222", "APPOINTMENT_CANCELLED", 0);
        given(outboxEventRepository.findPendingEvents(3)).willReturn(List.of(event));
        willThrow(new BusinessException(ErrorCode.EXTERNAL_SERVICE_ERROR, "broker down"))
                .given(eventPublisher).publishRaw(any(), any(), any());

        // when
        int published = outboxEventService.publishPendingEvents();

        // then
        assertThat(published).isZero();
        ArgumentCaptor<OutboxEvent> saved = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxEventRepository).save(saved.capture());
        assertThat(saved.getValue().retryCount()).isEqualTo(1);
        assertThat(saved.getValue().status()).isEqualTo(OutboxEventStatus.PENDING);
    }

    @Test
    @DisplayName("재시도 한도에 도달하면 FAILED로 전환한다")
    void marksFailedWhenRetriesExhausted() {
        // given
        OutboxEvent event = pending(3L, "A-33333333", "APPOINTMENT_BOOKED", 2);
        given(outboxEventRepository.findPendingEvents(3)).willReturn(List.of(event));
        willThrow(new BusinessException(ErrorCode.EXTERNAL_SERVICE_ERROR, "broker down"))
                .given(eventPublisher).publishRaw(any(), any(), any());

        // when
        outboxEventService.publishPendingEvents();

        // then
        ArgumentCaptor<OutboxEvent> saved = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxEventRepository).save(saved.capture());
        assertThat(saved.getValue().retryCount()).isEqualTo(3);
        assertThat(saved.getValue().status()).isEqualTo(OutboxEventStatus.FAILED);
    }

    private static OutboxEvent pending(Long id, String reservationId, String eventType, int retryCount) {
        return new OutboxEvent(id, "RESERVATION", reservationId, eventType, "{}",
                OutboxEventStatus.PENDING, LocalDateTime.now(), null, retryCount);
    }
}
