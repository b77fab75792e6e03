package personal.clinic.appointment.scheduling.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.clinic.appointment.scheduling.application.port.out.DoctorRepository;
import personal.clinic.appointment.scheduling.domain.model.Doctor;

import java.util.Optional;

/**
 * Doctor Persistence Adapter
 * JPA를 사용한 의사 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DoctorPersistenceAdapter implements DoctorRepository {

    private final JpaDoctorRepository jpaDoctorRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Doctor> findByDoctorId(String doctorId) {
        return jpaDoctorRepository.findByDoctorId(doctorId)
                .map(DoctorEntity::toDomain);
    }

    @Override
    @Transactional
    public boolean lockForBooking(String doctorId) {
        boolean locked = jpaDoctorRepository.findByDoctorIdForUpdate(doctorId).isPresent();
        log.debug("Doctor row lock: doctorId={}, found={}", doctorId, locked);
        return locked;
    }

    @Override
    @Transactional
    public Doctor save(Doctor doctor) {
        DoctorEntity saved = jpaDoctorRepository.save(DoctorEntity.fromDomain(doctor));
        return saved.toDomain();
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByDoctorId(String doctorId) {
        return jpaDoctorRepository.existsByDoctorId(doctorId);
    }
}
