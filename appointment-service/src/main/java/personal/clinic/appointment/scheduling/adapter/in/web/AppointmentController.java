package personal.clinic.appointment.scheduling.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.clinic.appointment.scheduling.adapter.in.web.dto.AvailabilityResponse;
import personal.clinic.appointment.scheduling.adapter.in.web.dto.BookSlotRequest;
import personal.clinic.appointment.scheduling.adapter.in.web.dto.CancelReservationResponse;
import personal.clinic.appointment.scheduling.adapter.in.web.dto.ReservationResponse;
import personal.clinic.appointment.scheduling.application.config.SchedulingProperties;
import personal.clinic.appointment.scheduling.application.port.in.BookSlotUseCase;
import personal.clinic.appointment.scheduling.application.port.in.CancelReservationUseCase;
import personal.clinic.appointment.scheduling.application.port.in.GetAvailabilityQuery;
import personal.clinic.appointment.scheduling.application.port.in.GetAvailabilityUseCase;
import personal.clinic.appointment.scheduling.application.port.in.GetReservationUseCase;
import personal.clinic.appointment.scheduling.domain.model.BookedAppointment;
import personal.clinic.appointment.scheduling.domain.model.CancellationResult;
import personal.clinic.appointment.scheduling.domain.model.DoctorAvailability;
import personal.clinic.appointment.scheduling.domain.model.ReservationDetails;

/**
 * Appointment API Controller
 * 예약 가능 슬롯 조회 및 진료 예약 관리 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AppointmentController {

    private final GetAvailabilityUseCase getAvailabilityUseCase;
    private final BookSlotUseCase bookSlotUseCase;
    private final CancelReservationUseCase cancelReservationUseCase;
    private final GetReservationUseCase getReservationUseCase;
    private final SchedulingProperties schedulingProperties;

    /**
     * 예약 가능 슬롯 조회
     * GET /api/v1/doctors/{doctorId}/availability?date=YYYY-MM-DD
     */
    @GetMapping("/doctors/{doctorId}/availability")
    public ResponseEntity<AvailabilityResponse> getAvailability(
            @PathVariable String doctorId,
            @RequestParam String date
    ) {
        log.info("Get availability: doctorId={}, date={}", doctorId, date);

        DoctorAvailability availability = getAvailabilityUseCase.getAvailability(GetAvailabilityQuery.of(doctorId, date));

        return ResponseEntity.ok(AvailabilityResponse.from(availability));
    }

    /**
     * 진료 예약 생성
     * POST /api/v1/appointments
     */
    @PostMapping("/appointments")
    public ResponseEntity<ReservationResponse> bookSlot(@Valid @RequestBody BookSlotRequest request) {
        log.info("Book slot: doctorId={}, date={}, timeSlot={}", request.doctorId(), request.date(), request.timeSlot());

        BookedAppointment booked = bookSlotUseCase.bookSlot(request.toCommand());

        ReservationResponse response = ReservationResponse.from(booked, schedulingProperties.offset());

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * 예약 취소
     * POST /api/v1/appointments/{reservationId}/cancel
     */
    @PostMapping("/appointments/{reservationId}/cancel")
    public ResponseEntity<CancelReservationResponse> cancel(@PathVariable String reservationId) {
        log.info("Cancel reservation: reservationId={}", reservationId);

        CancellationResult result = cancelReservationUseCase.cancel(reservationId);

        return ResponseEntity.ok(CancelReservationResponse.from(result));
    }

    /**
     * 예약 조회
     * GET /api/v1/appointments/{reservationId}
     */
    @GetMapping("/appointments/{reservationId}")
    public ResponseEntity<ReservationResponse> getReservation(@PathVariable String reservationId) {
        log.info("Get reservation: reservationId={}", reservationId);

        ReservationDetails details = getReservationUseCase.getReservation(reservationId);

        return ResponseEntity.ok(ReservationResponse.from(details, schedulingProperties.offset()));
    }
}
