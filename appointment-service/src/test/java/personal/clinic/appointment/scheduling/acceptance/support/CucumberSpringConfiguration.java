package personal.clinic.appointment.scheduling.acceptance.support;

import io.cucumber.spring.CucumberContextConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

/**
 * Cucumber와 Spring Boot를 통합하기 위한 설정 클래스
 * H2 인메모리 DB와 캘린더 Stub으로 실제 HTTP 요청을 검증한다.
 * 테스트 어댑터(@Component)는 컴포넌트 스캔으로 등록된다.
 */
@CucumberContextConfiguration
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import(TestCalendarClientConfig.class)
public class CucumberSpringConfiguration {
}
