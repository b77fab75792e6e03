package personal.clinic.appointment.scheduling.adapter.out.mail;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 확정 알림 메일 설정
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "appointment.notification")
public class NotificationProperties {

    private boolean enabled = true;

    private String fromAddress = "no-reply@clinic.local";
}
