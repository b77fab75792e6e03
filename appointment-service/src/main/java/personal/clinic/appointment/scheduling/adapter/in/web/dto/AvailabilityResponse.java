package personal.clinic.appointment.scheduling.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import personal.clinic.appointment.scheduling.domain.model.ClockTime;
import personal.clinic.appointment.scheduling.domain.model.Doctor;
import personal.clinic.appointment.scheduling.domain.model.DoctorAvailability;
import personal.clinic.appointment.scheduling.domain.model.Slot;
import personal.clinic.appointment.scheduling.domain.model.WorkingWindow;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * 예약 가능 슬롯 조회 응답 DTO
 * 휴진일이면 workingHours 없이 message를 채운다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AvailabilityResponse(
        LocalDate date,
        String doctorId,
        String doctorName,
        String specialty,
        BigDecimal consultationFee,
        WorkingHours workingHours,
        List<SlotResponse> availableSlots,
        int totalSlots,
        String message
) {
    static final String NOT_AVAILABLE_MESSAGE = "Doctor not available on this day";

    public static AvailabilityResponse from(DoctorAvailability availability) {
        Doctor doctor = availability.doctor();
        if (!availability.isWorkingDay()) {
            return new AvailabilityResponse(availability.date(), doctor.doctorId(), doctor.name(),
                    doctor.specialty(), doctor.consultationFee(), null, List.of(), 0, NOT_AVAILABLE_MESSAGE);
        }

        List<SlotResponse> slots = availability.availableSlots().stream()
                .map(SlotResponse::from)
                .toList();

        return new AvailabilityResponse(
                availability.date(),
                doctor.doctorId(),
                doctor.name(),
                doctor.specialty(),
                doctor.consultationFee(),
                WorkingHours.from(availability.window()),
                slots,
                slots.size(),
                null
        );
    }

    public record WorkingHours(String start, String end) {
        static WorkingHours from(WorkingWindow window) {
            return new WorkingHours(
                    ClockTime.from(window.start()).format(),
                    ClockTime.from(window.end()).format());
        }
    }

    public record SlotResponse(String time, String startTime, String endTime, String startIso, String endIso) {
        static SlotResponse from(Slot slot) {
            return new SlotResponse(
                    slot.label(),
                    slot.startLabel(),
                    slot.endLabel(),
                    slot.startAt().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                    slot.endAt().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        }
    }
}
