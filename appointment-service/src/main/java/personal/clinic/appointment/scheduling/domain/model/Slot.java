package personal.clinic.appointment.scheduling.domain.model;

import java.time.OffsetDateTime;

/**
 * 예약 가능한 후보 슬롯
 *
 * @param startAt 시작 (진료 오프셋 기준)
 * @param endAt   종료 (진료 오프셋 기준)
 */
public record Slot(OffsetDateTime startAt, OffsetDateTime endAt) {

    public Slot {
        TimeInterval.of(startAt, endAt);
    }

    public TimeInterval interval() {
        return TimeInterval.of(startAt, endAt);
    }

    public String startLabel() {
        return ClockTime.from(startAt.toLocalTime()).format();
    }

    public String endLabel() {
        return ClockTime.from(endAt.toLocalTime()).format();
    }

    /**
     * 화면 표시용 라벨 (예: "09:00 AM - 09:30 AM")
     */
    public String label() {
        return startLabel() + " - " + endLabel();
    }
}
