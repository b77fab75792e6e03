package personal.clinic.appointment.scheduling.acceptance.support;

import io.cucumber.spring.ScenarioScope;
import io.restassured.response.Response;
import lombok.Getter;
import lombok.Setter;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Appointment Acceptance Test Context
 * 같은 시나리오 안의 Step 클래스들이 공유하는 상태
 */
@Getter
@Setter
@Component
@ScenarioScope
public class AppointmentTestContext {

    /** 시나리오 기본 의사 ID */
    private String doctorId;
    /** 마지막 HTTP 응답 */
    private Response lastHttpResponse;
    /** 마지막으로 생성된 예약 ID */
    private String reservationId;
    /** 동시 예약 응답 */
    private final List<Response> concurrentResponses = new CopyOnWriteArrayList<>();
}
