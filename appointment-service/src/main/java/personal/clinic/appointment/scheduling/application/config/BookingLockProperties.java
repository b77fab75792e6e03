package personal.clinic.appointment.scheduling.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Booking Lock 설정 Properties
 *
 * 설정 예시:
 * appointment:
 *   booking:
 *     lock:
 *       strategy: redis   # local | redis
 *       wait-millis: 3000 # 락 대기 시간
 *       ttl-seconds: 10   # Redis 락 TTL
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "appointment.booking.lock")
public class BookingLockProperties {

    /**
     * 락 전략
     * - local: JVM 내 의사별 ReentrantLock (단일 인스턴스)
     * - redis: Redis SET NX 기반 의사별 락 (다중 인스턴스)
     */
    private String strategy = "local";

    private long waitMillis = 3000;

    /**
     * Redis 락 TTL (초)
     * 예약 트랜잭션 최대 시간보다 길어야 한다.
     */
    private int ttlSeconds = 10;

    public Duration waitDuration() {
        return Duration.ofMillis(waitMillis);
    }
}
