package personal.clinic.appointment.scheduling.adapter.out.calendar;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Google Calendar 연동 설정 Properties
 *
 * 설정 예시:
 * external:
 *   google-calendar:
 *     enabled: true
 *     base-url: https://www.googleapis.com
 *     access-token: ${GOOGLE_CALENDAR_ACCESS_TOKEN}
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "external.google-calendar")
public class GoogleCalendarProperties {

    /**
     * false이면 캘린더 연동이 설정되지 않은 것으로 간주 (조회는 빈 목록, 동기화는 SKIPPED)
     */
    private boolean enabled = false;

    private String baseUrl = "https://www.googleapis.com";

    private String accessToken;

    private int connectTimeoutMs = 500;

    /**
     * Circuit Breaker Slow Call 기준과 맞춘다.
     */
    private int readTimeoutMs = 2000;

    public boolean isConfigured() {
        return enabled && accessToken != null && !accessToken.isBlank();
    }
}
