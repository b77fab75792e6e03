package personal.clinic.appointment.scheduling.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.clinic.appointment.scheduling.domain.model.ExternalSyncStatus;
import personal.clinic.appointment.scheduling.domain.model.NotificationStatus;
import personal.clinic.appointment.scheduling.domain.model.ReservationStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JpaReservationRepository extends JpaRepository<ReservationEntity, Long> {

    Optional<ReservationEntity> findByReservationId(String reservationId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from ReservationEntity r where r.reservationId = :reservationId")
    Optional<ReservationEntity> findByReservationIdForUpdate(@Param("reservationId") String reservationId);

    /**
     * 반개구간 겹침: start < to AND end > from
     */
    @Query("""
            select r from ReservationEntity r
            where r.doctorId = :doctorId
              and r.status = :status
              and r.startAt < :to
              and r.endAt > :from
            order by r.startAt asc
            """)
    List<ReservationEntity> findOverlapping(@Param("doctorId") String doctorId,
                                            @Param("status") ReservationStatus status,
                                            @Param("from") Instant from,
                                            @Param("to") Instant to);

    @Modifying(clearAutomatically = true)
    @Query("""
            update ReservationEntity r
            set r.externalSyncStatus = :status, r.externalEventId = :eventId
            where r.reservationId = :reservationId
              and r.externalSyncStatus = :expected
            """)
    int updateExternalSync(@Param("reservationId") String reservationId,
                           @Param("status") ExternalSyncStatus status,
                           @Param("eventId") String eventId,
                           @Param("expected") ExternalSyncStatus expected);

    @Modifying(clearAutomatically = true)
    @Query("""
            update ReservationEntity r
            set r.notificationStatus = :status
            where r.reservationId = :reservationId
              and r.notificationStatus = :expected
            """)
    int updateNotification(@Param("reservationId") String reservationId,
                           @Param("status") NotificationStatus status,
                           @Param("expected") NotificationStatus expected);
}
