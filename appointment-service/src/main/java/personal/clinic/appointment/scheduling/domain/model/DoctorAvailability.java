package personal.clinic.appointment.scheduling.domain.model;

import java.time.LocalDate;
import java.util.List;

/**
 * 특정 날짜의 의사 예약 가능 슬롯 조회 결과
 */
public record DoctorAvailability(
        Doctor doctor,
        LocalDate date,
        WorkingWindow window,
        List<Slot> availableSlots) {

    public DoctorAvailability {
        availableSlots = List.copyOf(availableSlots);
    }

    public boolean isWorkingDay() {
        return window.isOpen();
    }
}
