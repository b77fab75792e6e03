package personal.clinic.appointment.scheduling.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import personal.clinic.appointment.scheduling.application.config.BookingLockProperties;
import personal.clinic.appointment.scheduling.application.port.out.DoctorLockRepository;

import java.time.Duration;

/**
 * Doctor Lock Adapter Factory
 * 설정에 따라 DoctorLockRepository 구현체를 생성
 *
 * 설정:
 * - appointment.booking.lock.strategy=local -> LocalDoctorLockAdapter (기본값)
 * - appointment.booking.lock.strategy=redis -> RedisDoctorLockAdapter
 */
@Slf4j
@Configuration
public class DoctorLockAdapterFactory {

    @Bean
    @ConditionalOnProperty(name = "appointment.booking.lock.strategy", havingValue = "local", matchIfMissing = true)
    public DoctorLockRepository localDoctorLockAdapter() {
        log.info("Creating LocalDoctorLockAdapter - booking serialized per doctor within this JVM");
        return new LocalDoctorLockAdapter();
    }

    @Bean
    @ConditionalOnProperty(name = "appointment.booking.lock.strategy", havingValue = "redis")
    public DoctorLockRepository redisDoctorLockAdapter(
            StringRedisTemplate redisTemplate,
            BookingLockProperties properties) {

        log.info("Creating RedisDoctorLockAdapter - TTL: {}s, wait: {}ms",
                properties.getTtlSeconds(), properties.getWaitMillis());
        RedisScript<Long> releaseLockScript =
                RedisScript.of(new ClassPathResource("scripts/release_lock.lua"), Long.class);
        return new RedisDoctorLockAdapter(
                redisTemplate,
                releaseLockScript,
                Duration.ofSeconds(properties.getTtlSeconds()));
    }
}
