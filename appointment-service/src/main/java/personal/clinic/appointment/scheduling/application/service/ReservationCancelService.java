package personal.clinic.appointment.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.clinic.appointment.scheduling.application.port.in.CancelReservationUseCase;
import personal.clinic.appointment.scheduling.application.port.out.ReservationRepository;
import personal.clinic.appointment.scheduling.domain.exception.ReservationNotFoundException;
import personal.clinic.appointment.scheduling.domain.model.CancellationResult;
import personal.clinic.appointment.scheduling.domain.model.Reservation;

/**
 * Reservation Cancel Service (SRP)
 * 단일 책임: 예약 취소
 * 예약 행을 잠근 뒤 상태를 확인하므로 동시 취소 요청 중 하나만 상태를 변경한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationCancelService implements CancelReservationUseCase {

    private final ReservationRepository reservationRepository;

    @Override
    @Transactional
    public CancellationResult cancel(String reservationId) {
        Reservation reservation = reservationRepository.findByReservationIdForUpdate(reservationId)
                .orElseThrow(() -> {
                    log.warn("Reservation not found for cancel: reservationId={}", reservationId);
                    return new ReservationNotFoundException(reservationId);
                });

        // 이미 취소된 경우 패스 (멱등성)
        if (reservation.isCancelled()) {
            log.info("Reservation is already cancelled: reservationId={}", reservationId);
            return new CancellationResult(reservation, true);
        }

        Reservation cancelled = reservationRepository.save(reservation.cancel());
        log.info("Reservation cancelled: reservationId={}, doctorId={}", reservationId, cancelled.doctorId());

        return new CancellationResult(cancelled, false);
    }
}
