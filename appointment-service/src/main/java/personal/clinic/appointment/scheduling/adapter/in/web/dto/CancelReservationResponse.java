package personal.clinic.appointment.scheduling.adapter.in.web.dto;

import personal.clinic.appointment.scheduling.domain.model.CancellationResult;
import personal.clinic.appointment.scheduling.domain.model.ReservationStatus;

/**
 * 예약 취소 응답 DTO
 */
public record CancelReservationResponse(
        String reservationId,
        ReservationStatus status,
        boolean alreadyCancelled
) {
    public static CancelReservationResponse from(CancellationResult result) {
        return new CancelReservationResponse(
                result.reservation().reservationId(),
                result.reservation().status(),
                result.alreadyCancelled());
    }
}
