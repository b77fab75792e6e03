package personal.clinic.appointment.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.clinic.appointment.scheduling.application.port.in.GetReservationUseCase;
import personal.clinic.appointment.scheduling.application.port.out.DoctorRepository;
import personal.clinic.appointment.scheduling.application.port.out.PatientRepository;
import personal.clinic.appointment.scheduling.application.port.out.ReservationRepository;
import personal.clinic.appointment.scheduling.domain.exception.ReservationNotFoundException;
import personal.clinic.appointment.scheduling.domain.model.Doctor;
import personal.clinic.appointment.scheduling.domain.model.Patient;
import personal.clinic.appointment.scheduling.domain.model.Reservation;
import personal.clinic.appointment.scheduling.domain.model.ReservationDetails;

import java.util.Optional;

/**
 * Reservation Query Service (SRP)
 * 단일 책임: 예약 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReservationQueryService implements GetReservationUseCase {

    private final ReservationRepository reservationRepository;
    private final DoctorRepository doctorRepository;
    private final PatientRepository patientRepository;

    @Override
    public ReservationDetails getReservation(String reservationId) {
        Reservation reservation = reservationRepository.findByReservationId(reservationId)
                .orElseThrow(() -> {
                    log.warn("Reservation not found: reservationId={}", reservationId);
                    return new ReservationNotFoundException(reservationId);
                });

        Optional<Doctor> doctor = doctorRepository.findByDoctorId(reservation.doctorId());
        Optional<Patient> patient = patientRepository.findByPatientId(reservation.patientId());

        log.debug("Reservation retrieved: reservationId={}", reservationId);

        return new ReservationDetails(
                reservation,
                doctor.map(Doctor::name).orElse(null),
                doctor.map(Doctor::specialty).orElse(null),
                patient.map(Patient::name).orElse(null));
    }
}
