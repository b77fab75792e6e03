package personal.clinic.appointment.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.clinic.appointment.scheduling.application.config.BookingLockProperties;
import personal.clinic.appointment.scheduling.application.config.SchedulingProperties;
import personal.clinic.appointment.scheduling.application.port.in.BookSlotCommand;
import personal.clinic.appointment.scheduling.application.port.in.BookSlotUseCase;
import personal.clinic.appointment.scheduling.application.port.out.DoctorLockRepository;
import personal.clinic.appointment.scheduling.application.port.out.DoctorRepository;
import personal.clinic.appointment.scheduling.domain.exception.BookingLockTimeoutException;
import personal.clinic.appointment.scheduling.domain.exception.DoctorNotFoundException;
import personal.clinic.appointment.scheduling.domain.exception.SlotConflictException;
import personal.clinic.appointment.scheduling.domain.model.BookedAppointment;
import personal.clinic.appointment.scheduling.domain.model.BookingResult;
import personal.clinic.appointment.scheduling.domain.model.Doctor;
import personal.clinic.appointment.scheduling.domain.model.RequestedTimeSlot;
import personal.clinic.appointment.scheduling.domain.model.ScheduleDate;
import personal.clinic.appointment.scheduling.domain.model.TimeInterval;
import personal.clinic.appointment.scheduling.domain.service.BookingManager;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Slot Booking Service (SRP)
 * 단일 책임: 진료 예약 처리
 * <p>
 * 1. 날짜/시간대 검증 (저장소 접근 전)
 * 2. 의사 단위 락 획득
 * 3. BookingManager 트랜잭션 (겹침 확인 + 저장 + Outbox)
 * 4. 커밋 이후 락 해제
 * 캘린더 동기화와 알림은 Outbox 이벤트를 통해 응답 이후에 처리된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlotBookingService implements BookSlotUseCase {

    private final SchedulingProperties schedulingProperties;
    private final BookingLockProperties lockProperties;
    private final DoctorRepository doctorRepository;
    private final DoctorLockRepository doctorLockRepository;
    private final BookingManager bookingManager;

    @Override
    public BookedAppointment bookSlot(BookSlotCommand command) {
        LocalDate date = ScheduleDate.parse(command.date());
        TimeInterval interval = RequestedTimeSlot.parse(command.timeSlot())
                .resolve(date, schedulingProperties.offset(), schedulingProperties.slotMinutes());

        Doctor doctor = doctorRepository.findByDoctorId(command.doctorId())
                .orElseThrow(() -> new DoctorNotFoundException(command.doctorId()));

        String owner = UUID.randomUUID().toString();
        boolean locked = doctorLockRepository.tryLock(doctor.doctorId(), owner, lockProperties.waitDuration());
        if (!locked) {
            log.warn("Booking lock timeout: doctorId={}, strategy={}",
                    doctor.doctorId(), doctorLockRepository.getStrategyName());
            throw new BookingLockTimeoutException(doctor.doctorId(), lockProperties.getWaitMillis());
        }

        BookingResult result;
        try {
            result = bookingManager.bookInTransaction(command, interval);

        } finally {
            doctorLockRepository.unlock(doctor.doctorId(), owner);
        }

        if (!result.booked()) {
            throw new SlotConflictException(doctor.doctorId(), result.conflictReason());
        }

        log.debug("Slot booked: reservationId={}, doctorId={}", result.reservation().reservationId(), doctor.doctorId());
        return new BookedAppointment(result.reservation(), doctor, result.patient());
    }
}
