package personal.clinic.appointment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Appointment Service Application
 * 의사 진료 슬롯 조회, 예약 충돌 판정, 예약 후속 처리(캘린더/알림)를 담당
 */
@EnableScheduling  // Outbox Scheduler 활성화
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.clinic.appointment",
        "personal.clinic.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class AppointmentServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(AppointmentServiceApplication.class, args);
    }
}
