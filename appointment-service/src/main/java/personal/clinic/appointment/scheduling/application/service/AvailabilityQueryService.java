package personal.clinic.appointment.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.clinic.appointment.scheduling.application.config.SchedulingProperties;
import personal.clinic.appointment.scheduling.application.port.in.GetAvailabilityQuery;
import personal.clinic.appointment.scheduling.application.port.in.GetAvailabilityUseCase;
import personal.clinic.appointment.scheduling.application.port.out.CalendarClient;
import personal.clinic.appointment.scheduling.application.port.out.DoctorRepository;
import personal.clinic.appointment.scheduling.application.port.out.ReservationRepository;
import personal.clinic.appointment.scheduling.domain.exception.DoctorNotFoundException;
import personal.clinic.appointment.scheduling.domain.model.Doctor;
import personal.clinic.appointment.scheduling.domain.model.DoctorAvailability;
import personal.clinic.appointment.scheduling.domain.model.Reservation;
import personal.clinic.appointment.scheduling.domain.model.Slot;
import personal.clinic.appointment.scheduling.domain.model.TimeInterval;
import personal.clinic.appointment.scheduling.domain.model.WorkingWindow;
import personal.clinic.appointment.scheduling.domain.service.ConflictResolver;
import personal.clinic.appointment.scheduling.domain.service.SlotGenerator;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Availability Query Service (SRP)
 * 단일 책임: 예약 가능 슬롯 조회
 * <p>
 * 외부 캘린더 조회 실패는 "바쁜 시간 없음"으로 처리한다.
 * 최종 충돌 판단은 예약 트랜잭션이 하므로 조회 결과는 진행 중인 예약보다 늦을 수 있다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityQueryService implements GetAvailabilityUseCase {

    private final SchedulingProperties schedulingProperties;
    private final DoctorRepository doctorRepository;
    private final ReservationRepository reservationRepository;
    private final CalendarClient calendarClient;
    private final SlotGenerator slotGenerator;
    private final ConflictResolver conflictResolver;

    @Override
    public DoctorAvailability getAvailability(GetAvailabilityQuery query) {
        Doctor doctor = doctorRepository.findByDoctorId(query.doctorId())
                .orElseThrow(() -> {
                    log.warn("Doctor not found: doctorId={}", query.doctorId());
                    return new DoctorNotFoundException(query.doctorId());
                });

        LocalDate date = query.date();
        WorkingWindow window = doctor.windowOn(date);
        if (!window.isOpen()) {
            log.debug("Doctor not working: doctorId={}, date={}", doctor.doctorId(), date);
            return new DoctorAvailability(doctor, date, window, List.of());
        }

        ZoneOffset offset = schedulingProperties.offset();
        List<Slot> candidates = slotGenerator.generateSlots(date, window, schedulingProperties.slotMinutes(), offset);

        TimeInterval day = TimeInterval.ofDay(date, offset);
        List<TimeInterval> busyPeriods = fetchBusyPeriods(doctor, day, offset);
        List<Reservation> reservations = reservationRepository.findConfirmedOverlapping(doctor.doctorId(), day);

        List<Slot> available = conflictResolver.filterAvailable(candidates, busyPeriods, reservations);

        log.debug("Availability computed: doctorId={}, date={}, candidates={}, busy={}, reserved={}, available={}",
                doctor.doctorId(), date, candidates.size(), busyPeriods.size(), reservations.size(), available.size());

        return new DoctorAvailability(doctor, date, window, available);
    }

    private List<TimeInterval> fetchBusyPeriods(Doctor doctor, TimeInterval day, ZoneOffset offset) {
        if (!doctor.hasCalendar() || !calendarClient.isConfigured()) {
            return List.of();
        }
        try {
            return calendarClient.queryBusyPeriods(doctor.calendarId(), day.startAt(offset), day.endAt(offset));
        } catch (Exception e) {
            log.warn("Calendar busy lookup failed, using ledger only: doctorId={}, calendarId={}",
                    doctor.doctorId(), doctor.calendarId(), e);
            return List.of();
        }
    }
}
