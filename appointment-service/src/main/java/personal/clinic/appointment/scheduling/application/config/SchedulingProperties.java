package personal.clinic.appointment.scheduling.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneOffset;

/**
 * Scheduling 설정 Properties
 * application.yml의 appointment.scheduling.* 설정을 바인딩
 *
 * @param slotMinutes     슬롯 길이 (분)
 * @param zoneOffset      진료 시간 기준 오프셋 (예: +05:30)
 * @param defaultTimezone 캘린더 이벤트 기본 타임존
 */
@ConfigurationProperties(prefix = "appointment.scheduling")
public record SchedulingProperties(
        int slotMinutes,
        String zoneOffset,
        String defaultTimezone
) {
    public SchedulingProperties {
        if (slotMinutes <= 0) {
            slotMinutes = 30;
        }
        if (zoneOffset == null || zoneOffset.isBlank()) {
            zoneOffset = "+05:30";
        }
        if (defaultTimezone == null || defaultTimezone.isBlank()) {
            defaultTimezone = "Asia/Kolkata";
        }
    }

    public ZoneOffset offset() {
        return ZoneOffset.of(zoneOffset);
    }
}
