package personal.clinic.appointment.scheduling.domain.service;

import org.springframework.stereotype.Component;
import personal.clinic.appointment.scheduling.domain.model.Slot;
import personal.clinic.appointment.scheduling.domain.model.WorkingWindow;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Slot Generator
 * 진료 시간대를 고정 길이의 연속 슬롯으로 분할한다.
 * <p>
 * 슬롯은 window.start부터 시작해 빈틈없이 이어지며, 마지막 슬롯의 종료는 window.end를 넘지 않는다.
 * 남는 자투리 시간은 슬롯으로 만들지 않는다.
 */
@Component
public class SlotGenerator {

    public List<Slot> generateSlots(LocalDate date, WorkingWindow window, int granularityMinutes, ZoneOffset offset) {
        if (granularityMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Slot granularity must be positive: granularityMinutes=%d", granularityMinutes));
        }
        if (window == null || !window.isOpen()) {
            return List.of();
        }

        int startMinute = window.start().toSecondOfDay() / 60;
        int endMinute = window.end().toSecondOfDay() / 60;
        OffsetDateTime dayStart = date.atStartOfDay().atOffset(offset);

        List<Slot> slots = new ArrayList<>();
        for (int minute = startMinute; minute + granularityMinutes <= endMinute; minute += granularityMinutes) {
            Slot slot = new Slot(dayStart.plusMinutes(minute), dayStart.plusMinutes(minute + granularityMinutes));
            if (window.withinWindow(slot.interval(), date, offset)) {
                slots.add(slot);
            }
        }
        return List.copyOf(slots);
    }
}
