package personal.clinic.appointment.scheduling.adapter.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface JpaDoctorRepository extends JpaRepository<DoctorEntity, Long> {

    Optional<DoctorEntity> findByDoctorId(String doctorId);

    boolean existsByDoctorId(String doctorId);

    /**
     * 의사 행 배타 락 (SELECT ... FOR UPDATE)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select d from DoctorEntity d where d.doctorId = :doctorId")
    Optional<DoctorEntity> findByDoctorIdForUpdate(@Param("doctorId") String doctorId);
}
