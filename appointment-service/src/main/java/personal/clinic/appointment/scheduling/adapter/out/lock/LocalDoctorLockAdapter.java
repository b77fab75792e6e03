package personal.clinic.appointment.scheduling.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import personal.clinic.appointment.scheduling.application.port.out.DoctorLockRepository;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Local Doctor Lock Adapter
 * 의사별 ReentrantLock (fair)으로 같은 JVM 안의 예약 요청을 직렬화한다.
 *
 * 사용 환경:
 * - 로컬 개발, 테스트, 단일 인스턴스 배포
 *
 * 주의: 다중 인스턴스 운영 환경에서는 RedisDoctorLockAdapter를 사용해야 한다.
 */
@Slf4j
public class LocalDoctorLockAdapter implements DoctorLockRepository {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public boolean tryLock(String doctorId, String owner, Duration wait) {
        ReentrantLock lock = locks.computeIfAbsent(doctorId, id -> new ReentrantLock(true));
        try {
            boolean acquired = lock.tryLock(wait.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("[LocalLock] Lock attempt: doctorId={}, owner={}, acquired={}", doctorId, owner, acquired);
            return acquired;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[LocalLock] Interrupted while waiting: doctorId={}", doctorId);
            return false;
        }
    }

    @Override
    public void unlock(String doctorId, String owner) {
        ReentrantLock lock = locks.get(doctorId);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("[LocalLock] Lock released: doctorId={}, owner={}", doctorId, owner);
        } else {
            log.warn("[LocalLock] Lock not held by current thread: doctorId={}, owner={}", doctorId, owner);
        }
    }

    @Override
    public String getStrategyName() {
        return "local";
    }
}
