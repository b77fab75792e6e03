package personal.clinic.appointment.scheduling.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface JpaPatientRepository extends JpaRepository<PatientEntity, Long> {

    Optional<PatientEntity> findByPatientId(String patientId);

    Optional<PatientEntity> findFirstByEmailOrderByIdAsc(String email);

    Optional<PatientEntity> findFirstByPhoneOrderByIdAsc(String phone);
}
