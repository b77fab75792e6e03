package personal.clinic.appointment.scheduling.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.clinic.appointment.scheduling.application.port.in.BookSlotCommand;
import personal.clinic.appointment.scheduling.application.port.out.DoctorRepository;
import personal.clinic.appointment.scheduling.application.port.out.PatientRepository;
import personal.clinic.appointment.scheduling.application.port.out.ReservationRepository;
import personal.clinic.appointment.scheduling.domain.exception.DoctorNotFoundException;
import personal.clinic.appointment.scheduling.domain.model.BookingResult;
import personal.clinic.appointment.scheduling.domain.model.Patient;
import personal.clinic.appointment.scheduling.domain.model.Reservation;
import personal.clinic.appointment.scheduling.domain.model.TimeInterval;

import java.util.List;
import java.util.Optional;

/**
 * Booking Domain Service (Transaction Manager)
 * 겹침 확인과 예약 저장을 하나의 트랜잭션으로 수행하는 실행 전용 서비스
 * <p>
 * 호출자는 의사 단위 락을 잡은 상태에서 호출하고, 커밋 이후에 락을 해제해야 한다.
 * 트랜잭션 안에서는 의사 행에 FOR UPDATE 락을 한 번 더 걸어 락 TTL 만료 상황에서도 직렬화를 유지한다.
 * Outbox 기록은 ReservationRepository Adapter 내부에서 수행된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingManager {

    private final DoctorRepository doctorRepository;
    private final PatientRepository patientRepository;
    private final ReservationRepository reservationRepository;
    private final ConflictResolver conflictResolver;

    @Transactional
    public BookingResult bookInTransaction(BookSlotCommand command, TimeInterval interval) {
        // 1. 의사 행 잠금
        if (!doctorRepository.lockForBooking(command.doctorId())) {
            throw new DoctorNotFoundException(command.doctorId());
        }

        // 2. 겹치는 확정 예약 확인
        List<Reservation> overlapping = reservationRepository.findConfirmedOverlapping(command.doctorId(), interval);
        Optional<Reservation> blocking = conflictResolver.findBlockingReservation(interval, overlapping);
        if (blocking.isPresent()) {
            log.info("Slot conflict detected: doctorId={}, start={}, blockingReservationId={}",
                    command.doctorId(), interval.start(), blocking.get().reservationId());
            return BookingResult.conflict("overlaps reservation " + blocking.get().reservationId());
        }

        // 3. 환자 등록/갱신 후 확정 예약 저장
        Patient patient = upsertPatient(command);
        Reservation reservation = Reservation.confirm(
                command.doctorId(),
                patient.patientId(),
                interval,
                command.metadata());

        Reservation saved = reservationRepository.save(reservation);
        log.info("Reservation confirmed: reservationId={}, doctorId={}, patientId={}, start={}",
                saved.reservationId(), saved.doctorId(), saved.patientId(), interval.start());

        return BookingResult.booked(saved, patient);
    }

    private Patient upsertPatient(BookSlotCommand command) {
        Patient patient = patientRepository.findByContact(command.patientEmail(), command.patientPhone())
                .map(existing -> existing.updateContact(
                        command.patientName(), command.patientEmail(), command.patientPhone()))
                .orElseGet(() -> Patient.register(
                        command.patientName(), command.patientEmail(), command.patientPhone()));
        return patientRepository.save(patient);
    }
}
