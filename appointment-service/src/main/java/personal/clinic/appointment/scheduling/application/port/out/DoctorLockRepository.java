package personal.clinic.appointment.scheduling.application.port.out;

import java.time.Duration;

/**
 * Doctor Lock Repository (Output Port)
 * 의사 단위 예약 락
 * <p>
 * 같은 의사에 대한 "겹침 확인 + 예약 저장"을 한 번에 하나씩만 수행하도록 보장한다.
 * 구현체는 단일 인스턴스용(JVM 락)과 다중 인스턴스용(Redis 락)이 있으며 설정으로 선택한다.
 */
public interface DoctorLockRepository {

    /**
     * 락 획득 시도
     *
     * @param doctorId 의사 ID
     * @param owner    락 소유자 토큰 (요청마다 고유)
     * @param wait     최대 대기 시간
     * @return 획득 성공 시 true, 대기 시간 초과 시 false
     */
    boolean tryLock(String doctorId, String owner, Duration wait);

    /**
     * 락 해제 (소유자가 일치할 때만)
     */
    void unlock(String doctorId, String owner);

    String getStrategyName();
}
