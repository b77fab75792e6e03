package personal.clinic.appointment.scheduling.acceptance.steps;

import io.cucumber.java.en.And;
import io.cucumber.java.en.When;
import lombok.RequiredArgsConstructor;
import personal.clinic.appointment.scheduling.acceptance.support.AppointmentHttpAdapter;
import personal.clinic.appointment.scheduling.acceptance.support.AppointmentTestContext;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 헬스 체크 Step
 */
@RequiredArgsConstructor
public class HealthCheckSteps {

    private final AppointmentHttpAdapter httpAdapter;
    private final AppointmentTestContext context;

    @When("헬스 체크 API를 호출한다")
    public void 헬스_체크_API를_호출한다() {
        context.setLastHttpResponse(httpAdapter.healthCheck());
    }

    @And("데이터베이스 상태는 {string}이다")
    public void 데이터베이스_상태는(String status) {
        assertThat(context.getLastHttpResponse().jsonPath().getString("data.database")).isEqualTo(status);
        assertThat(context.getLastHttpResponse().jsonPath().getMap("data")).containsKeys("redis", "kafka");
    }
}
