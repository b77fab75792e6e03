package personal.clinic.appointment.scheduling.domain.service;

import org.springframework.stereotype.Component;
import personal.clinic.appointment.scheduling.domain.model.Reservation;
import personal.clinic.appointment.scheduling.domain.model.Slot;
import personal.clinic.appointment.scheduling.domain.model.TimeInterval;

import java.util.List;
import java.util.Optional;

/**
 * Conflict Resolver
 * 후보 슬롯 중 바쁜 시간, 확정 예약과 겹치지 않는 것만 남긴다.
 * 취소된 예약은 슬롯을 점유하지 않는다.
 */
@Component
public class ConflictResolver {

    public List<Slot> filterAvailable(List<Slot> candidates, List<TimeInterval> busyPeriods,
                                      List<Reservation> existingReservations) {
        return candidates.stream()
                .filter(slot -> isFree(slot.interval(), busyPeriods, existingReservations))
                .toList();
    }

    public boolean isFree(TimeInterval candidate, List<TimeInterval> busyPeriods,
                          List<Reservation> existingReservations) {
        boolean busy = busyPeriods.stream().anyMatch(candidate::overlaps);
        return !busy && findBlockingReservation(candidate, existingReservations).isEmpty();
    }

    public Optional<Reservation> findBlockingReservation(TimeInterval candidate, List<Reservation> reservations) {
        return reservations.stream()
                .filter(reservation -> reservation.blocks(candidate))
                .findFirst();
    }
}
