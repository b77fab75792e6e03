package personal.clinic.appointment.scheduling.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.clinic.appointment.scheduling.application.port.out.ReservationEventPort;
import personal.clinic.appointment.scheduling.application.port.out.ReservationRepository;
import personal.clinic.appointment.scheduling.domain.model.ExternalSyncStatus;
import personal.clinic.appointment.scheduling.domain.model.NotificationStatus;
import personal.clinic.appointment.scheduling.domain.model.Reservation;
import personal.clinic.appointment.scheduling.domain.model.ReservationStatus;
import personal.clinic.appointment.scheduling.domain.model.TimeInterval;

import java.util.List;
import java.util.Optional;

/**
 * Reservation Persistence Adapter
 * JPA를 사용한 예약 저장소 구현체
 * Transactional Outbox Pattern: 저장 시 ReservationEventPort에 이벤트 기록 위임
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationPersistenceAdapter implements ReservationRepository {

    private final JpaReservationRepository jpaReservationRepository;
    private final ReservationEventPort reservationEventPort;

    @Override
    public Reservation save(Reservation reservation) {
        log.debug("Saving reservation: reservationId={}, status={}", reservation.reservationId(), reservation.status());

        var saved = jpaReservationRepository.save(ReservationEntity.fromDomain(reservation));
        var savedReservation = saved.toDomain();

        reservationEventPort.recordReservationEvent(savedReservation);

        return savedReservation;
    }

    @Override
    public Optional<Reservation> findByReservationId(String reservationId) {
        return jpaReservationRepository.findByReservationId(reservationId)
                .map(ReservationEntity::toDomain);
    }

    @Override
    public Optional<Reservation> findByReservationIdForUpdate(String reservationId) {
        return jpaReservationRepository.findByReservationIdForUpdate(reservationId)
                .map(ReservationEntity::toDomain);
    }

    @Override
    public List<Reservation> findConfirmedOverlapping(String doctorId, TimeInterval range) {
        return jpaReservationRepository.findOverlapping(
                        doctorId, ReservationStatus.CONFIRMED, range.start(), range.end())
                .stream()
                .map(ReservationEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public boolean recordCalendarSync(String reservationId, ExternalSyncStatus status, String externalEventId) {
        int updated = jpaReservationRepository.updateExternalSync(
                reservationId, status, externalEventId, ExternalSyncStatus.PENDING);
        return updated > 0;
    }

    @Override
    @Transactional
    public boolean recordNotification(String reservationId, NotificationStatus status) {
        int updated = jpaReservationRepository.updateNotification(
                reservationId, status, NotificationStatus.PENDING);
        return updated > 0;
    }
}
