package personal.clinic.appointment.scheduling.application.port.in;

import personal.clinic.appointment.scheduling.domain.model.DoctorAvailability;

/**
 * Get Availability UseCase (Input Port)
 * 의사의 특정 날짜 예약 가능 슬롯 조회
 */
public interface GetAvailabilityUseCase {

    /**
     * 예약 가능 슬롯 조회
     * 진료 시간대를 슬롯으로 나눈 뒤, 외부 캘린더의 바쁜 시간과 확정 예약에 겹치는 슬롯을 제외한다.
     * 외부 캘린더 조회가 실패하면 바쁜 시간 없이 계산한다.
     *
     * @throws personal.clinic.appointment.scheduling.domain.exception.DoctorNotFoundException 의사를 찾을 수 없을 때
     */
    DoctorAvailability getAvailability(GetAvailabilityQuery query);
}
