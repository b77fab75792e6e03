package personal.clinic.appointment.scheduling.acceptance.support;

import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import io.restassured.response.Response;
import io.restassured.specification.RequestSpecification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Appointment API HTTP Adapter
 * 인수 테스트용 순수 HTTP 클라이언트
 * Environment를 통해 런타임에 포트를 가져옴 (lazy initialization)
 */
@Slf4j
@Component
public class AppointmentHttpAdapter {

    private static final String BASE_URI = "http://localhost";
    private final Environment environment;

    public AppointmentHttpAdapter(Environment environment) {
        this.environment = environment;
    }

    private int getPort() {
        return environment.getProperty("local.server.port", Integer.class, 8081);
    }

    private RequestSpecification givenRequest() {
        return RestAssured.given()
                .baseUri(BASE_URI)
                .port(getPort())
                .contentType(ContentType.JSON);
    }

    /**
     * GET /api/v1/doctors/{doctorId}/availability?date=
     */
    public Response getAvailability(String doctorId, String date) {
        log.debug(">>> HTTP: GET /doctors/{}/availability?date={}", doctorId, date);
        return givenRequest()
                .queryParam("date", date)
                .when()
                .get("/api/v1/doctors/{doctorId}/availability", doctorId)
                .then()
                .extract()
                .response();
    }

    /**
     * POST /api/v1/appointments
     */
    public Response bookSlot(Map<String, Object> body) {
        log.debug(">>> HTTP: POST /appointments - body={}", body);
        return givenRequest()
                .body(body)
                .when()
                .post("/api/v1/appointments")
                .then()
                .extract()
                .response();
    }

    /**
     * POST /api/v1/appointments/{reservationId}/cancel
     */
    public Response cancel(String reservationId) {
        log.debug(">>> HTTP: POST /appointments/{}/cancel", reservationId);
        return givenRequest()
                .when()
                .post("/api/v1/appointments/{reservationId}/cancel", reservationId)
                .then()
                .extract()
                .response();
    }

    /**
     * GET /api/v1/appointments/{reservationId}
     */
    public Response getReservation(String reservationId) {
        log.debug(">>> HTTP: GET /appointments/{}", reservationId);
        return givenRequest()
                .when()
                .get("/api/v1/appointments/{reservationId}", reservationId)
                .then()
                .extract()
                .response();
    }

    /**
     * GET /api/v1/health
     */
    public Response healthCheck() {
        return givenRequest()
                .when()
                .get("/api/v1/health")
                .then()
                .extract()
                .response();
    }
}
