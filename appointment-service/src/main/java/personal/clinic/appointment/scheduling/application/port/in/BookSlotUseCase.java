package personal.clinic.appointment.scheduling.application.port.in;

import personal.clinic.appointment.scheduling.domain.model.BookedAppointment;

/**
 * Book Slot UseCase (Input Port)
 * 진료 예약 유스케이스
 */
public interface BookSlotUseCase {

    /**
     * 진료 예약
     * 의사 단위 락을 잡은 상태에서 겹침 확인과 저장을 하나의 트랜잭션으로 수행한다.
     *
     * @param command 예약 커맨드
     * @return CONFIRMED 상태의 예약과 의사/환자 정보
     * @throws personal.clinic.appointment.scheduling.domain.exception.InvalidIntervalException 날짜/시간대 형식 오류
     * @throws personal.clinic.appointment.scheduling.domain.exception.DoctorNotFoundException 의사를 찾을 수 없을 때
     * @throws personal.clinic.appointment.scheduling.domain.exception.SlotConflictException 확정 예약과 겹칠 때 (409 Conflict)
     * @throws personal.clinic.appointment.scheduling.domain.exception.BookingLockTimeoutException 대기 시간 내 락 획득 실패
     */
    BookedAppointment bookSlot(BookSlotCommand command);
}
