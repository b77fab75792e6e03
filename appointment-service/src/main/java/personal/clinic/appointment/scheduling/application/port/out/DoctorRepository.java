package personal.clinic.appointment.scheduling.application.port.out;

import personal.clinic.appointment.scheduling.domain.model.Doctor;

import java.util.Optional;

/**
 * Doctor Repository (Output Port)
 */
public interface DoctorRepository {

    Optional<Doctor> findByDoctorId(String doctorId);

    /**
     * 예약 트랜잭션 안에서 의사 행에 배타 락(SELECT ... FOR UPDATE)을 건다.
     * 같은 의사에 대한 예약 트랜잭션은 이 지점에서 직렬화된다.
     *
     * @return 의사가 존재하면 true
     */
    boolean lockForBooking(String doctorId);

    Doctor save(Doctor doctor);

    boolean existsByDoctorId(String doctorId);
}
