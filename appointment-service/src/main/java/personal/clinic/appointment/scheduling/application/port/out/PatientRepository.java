package personal.clinic.appointment.scheduling.application.port.out;

import personal.clinic.appointment.scheduling.domain.model.Patient;

import java.util.Optional;

/**
 * Patient Repository (Output Port)
 */
public interface PatientRepository {

    /**
     * 이메일 우선, 없으면 전화번호로 기존 환자 조회
     */
    Optional<Patient> findByContact(String email, String phone);

    Optional<Patient> findByPatientId(String patientId);

    Patient save(Patient patient);
}
