package personal.clinic.appointment.scheduling.domain.model;

/**
 * 예약 취소 결과
 *
 * @param alreadyCancelled 이미 취소된 예약에 대한 재요청이면 true (상태 변경 없음)
 */
public record CancellationResult(Reservation reservation, boolean alreadyCancelled) {
}
