package personal.clinic.appointment.scheduling.domain.model;

import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;

/**
 * 요일별 진료 시간대
 * start >= end 인 경우 열려 있는 시간이 없는 것으로 본다.
 */
public record WorkingWindow(boolean available, LocalTime start, LocalTime end) {

    public WorkingWindow {
        if (available && (start == null || end == null)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Working window start and end are required when available");
        }
    }

    public static WorkingWindow of(LocalTime start, LocalTime end) {
        return new WorkingWindow(true, start, end);
    }

    public static WorkingWindow closed() {
        return new WorkingWindow(false, null, null);
    }

    public boolean isOpen() {
        return available && start.isBefore(end);
    }

    /**
     * 구간이 해당 날짜의 진료 시간 [start, end) 안에 완전히 들어가는지 판단한다.
     * 휴진이거나 열린 시간이 없으면 항상 false.
     */
    public boolean withinWindow(TimeInterval interval, LocalDate date, ZoneOffset offset) {
        if (!isOpen()) {
            return false;
        }
        TimeInterval window = TimeInterval.of(date.atTime(start).atOffset(offset), date.atTime(end).atOffset(offset));
        return window.contains(interval);
    }
}
