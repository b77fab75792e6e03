package personal.clinic.appointment.scheduling.adapter.out.calendar;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Google Calendar RestClient Configuration
 *
 * Timeout 전략:
 * - Connect Timeout: TCP 연결 실패 빠른 감지
 * - Read Timeout: Circuit Breaker Slow Call 기준과 일치
 */
@Configuration
@RequiredArgsConstructor
public class CalendarRestClientConfig {

    private final GoogleCalendarProperties properties;

    @Bean
    public RestClient googleCalendarRestClient() {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(properties.getReadTimeoutMs()));

        RestClient.Builder builder = RestClient.builder()
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory);

        if (properties.isConfigured()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getAccessToken());
        }
        return builder.build();
    }
}
