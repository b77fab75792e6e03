package personal.clinic.appointment.scheduling.adapter.out.lock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import personal.clinic.appointment.scheduling.application.port.out.DoctorLockRepository;

import java.time.Duration;
import java.util.List;

/**
 * Redis Doctor Lock Adapter
 * Redis SET NX PX 기반 의사별 분산 락
 * Lua Script를 사용한 원자적 락 해제 (소유권 검증)
 *
 * 특징:
 * - 획득 실패 시 대기 시간 동안 짧은 간격으로 재시도
 * - TTL로 인스턴스 장애 시에도 락이 영구히 남지 않음
 */
@Slf4j
@RequiredArgsConstructor
public class RedisDoctorLockAdapter implements DoctorLockRepository {

    private static final String LOCK_PREFIX = "booking:lock:doctor:";
    private static final long RETRY_INTERVAL_MILLIS = 25;

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> releaseLockScript;
    private final Duration lockTtl;

    @Override
    public boolean tryLock(String doctorId, String owner, Duration wait) {
        String key = LOCK_PREFIX + doctorId;
        long deadline = System.nanoTime() + wait.toNanos();

        while (true) {
            Boolean success = redisTemplate.opsForValue().setIfAbsent(key, owner, lockTtl);
            if (Boolean.TRUE.equals(success)) {
                log.debug("[RedisLock] Lock acquired: key={}, owner={}", key, owner);
                return true;
            }
            if (System.nanoTime() >= deadline) {
                log.debug("[RedisLock] Lock wait exceeded: key={}", key);
                return false;
            }
            try {
                Thread.sleep(RETRY_INTERVAL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[RedisLock] Interrupted while waiting: key={}", key);
                return false;
            }
        }
    }

    @Override
    public void unlock(String doctorId, String owner) {
        String key = LOCK_PREFIX + doctorId;

        try {
            // GET + DEL을 원자적으로 수행하여 소유권 검증
            Long result = redisTemplate.execute(releaseLockScript, List.of(key), owner);

            if (result != null && result == 1L) {
                log.debug("[RedisLock] Lock released: key={}, owner={}", key, owner);
            } else {
                log.warn("[RedisLock] Lock not released (not owner or expired): key={}, owner={}", key, owner);
            }
        } catch (Exception e) {
            // 해제 실패 시 TTL에 의해 자동 해제
            log.error("[RedisLock] Failed to release lock: key={}, owner={}", key, owner, e);
        }
    }

    @Override
    public String getStrategyName() {
        return "redis";
    }
}
