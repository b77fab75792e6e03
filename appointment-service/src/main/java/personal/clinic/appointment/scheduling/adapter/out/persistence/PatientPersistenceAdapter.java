package personal.clinic.appointment.scheduling.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.clinic.appointment.scheduling.application.port.out.PatientRepository;
import personal.clinic.appointment.scheduling.domain.model.Patient;

import java.util.Optional;

/**
 * Patient Persistence Adapter
 */
@Component
@RequiredArgsConstructor
public class PatientPersistenceAdapter implements PatientRepository {

    private final JpaPatientRepository jpaPatientRepository;

    @Override
    public Optional<Patient> findByContact(String email, String phone) {
        Optional<PatientEntity> byEmail = hasText(email)
                ? jpaPatientRepository.findFirstByEmailOrderByIdAsc(email.trim())
                : Optional.empty();
        if (byEmail.isPresent()) {
            return byEmail.map(PatientEntity::toDomain);
        }
        return hasText(phone)
                ? jpaPatientRepository.findFirstByPhoneOrderByIdAsc(phone.trim()).map(PatientEntity::toDomain)
                : Optional.empty();
    }

    @Override
    public Optional<Patient> findByPatientId(String patientId) {
        return jpaPatientRepository.findByPatientId(patientId)
                .map(PatientEntity::toDomain);
    }

    @Override
    public Patient save(Patient patient) {
        return jpaPatientRepository.save(PatientEntity.fromDomain(patient)).toDomain();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
