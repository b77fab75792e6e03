package personal.clinic.appointment.scheduling.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import personal.clinic.appointment.scheduling.application.config.BookingLockProperties;
import personal.clinic.appointment.scheduling.application.port.in.BookSlotCommand;
import personal.clinic.appointment.scheduling.application.port.out.DoctorLockRepository;
import personal.clinic.appointment.scheduling.application.port.out.DoctorRepository;
import personal.clinic.appointment.scheduling.domain.exception.BookingLockTimeoutException;
import personal.clinic.appointment.scheduling.domain.exception.DoctorNotFoundException;
import personal.clinic.appointment.scheduling.domain.exception.InvalidIntervalException;
import personal.clinic.appointment.scheduling.domain.exception.PatientContactRequiredException;
import personal.clinic.appointment.scheduling.domain.exception.SlotConflictException;
import personal.clinic.appointment.scheduling.domain.model.BookedAppointment;
import personal.clinic.appointment.scheduling.domain.model.BookingMetadata;
import personal.clinic.appointment.scheduling.domain.model.BookingResult;
import personal.clinic.appointment.scheduling.domain.model.Reservation;
import personal.clinic.appointment.scheduling.domain.service.BookingManager;
import personal.clinic.common.exception.BusinessException;
import personal.clinic.common.exception.ErrorCode;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static personal.clinic.appointment.scheduling.support.SchedulingFixtures.DOCTOR_ID;
import static personal.clinic.appointment.scheduling.support.SchedulingFixtures.confirmed;
import static personal.clinic.appointment.scheduling.support.SchedulingFixtures.doctor;
import static personal.clinic.appointment.scheduling.support.SchedulingFixtures.interval;
import static personal.clinic.appointment.scheduling.support.SchedulingFixtures.patient;
import static personal.clinic.appointment.scheduling.support.SchedulingFixtures.schedulingProperties;

@ExtendWith(MockitoExtension.class)
@DisplayName("SlotBookingService 단위 테스트")
class SlotBookingServiceTest {

    @Mock
    private DoctorRepository doctorRepository;
    @Mock
    private DoctorLockRepository doctorLockRepository;
    @Mock
    private BookingManager bookingManager;

    private SlotBookingService slotBookingService;

    @BeforeEach
    void setUp() {
        BookingLockProperties lockProperties = new BookingLockProperties();
        lockProperties.setWaitMillis(3000);
        slotBookingService = new SlotBookingService(
                schedulingProperties(), lockProperties, doctorRepository, doctorLockRepository, bookingManager);
    }

    @Test
    @DisplayName("예약 성공 - 확정 예약을 반환하고 락을 해제한다")
    void bookSlot_Success() {
        // given
        Reservation reservation = confirmed("A-12345678", interval(9, 0, 9, 30));
        given(doctorRepository.findByDoctorId(DOCTOR_ID)).willReturn(Optional.of(doctor()));
        given(doctorLockRepository.tryLock(eq(DOCTOR_ID), anyString(), eq(Duration.ofMillis(3000)))).willReturn(true);
        given(bookingManager.bookInTransaction(any(), eq(interval(9, 0, 9, 30))))
                .willReturn(BookingResult.booked(reservation, patient()));

        // when
        BookedAppointment booked = slotBookingService.bookSlot(command("09:00 AM"));

        // then
        assertThat(booked.reservation().reservationId()).isEqualTo("A-12345678");
        assertThat(booked.doctor().doctorId()).isEqualTo(DOCTOR_ID);
        assertThat(booked.patient().name()).isEqualTo("Ravi Kumar");
        verify(doctorLockRepository).unlock(eq(DOCTOR_ID), anyString());
    }

    @Test
    @DisplayName("겹치는 확정 예약이 있으면 SLOT_CONFLICT, 락은 해제된다")
    void bookSlot_Conflict() {
        // given
        given(doctorRepository.findByDoctorId(DOCTOR_ID)).willReturn(Optional.of(doctor()));
        given(doctorLockRepository.tryLock(eq(DOCTOR_ID), anyString(), any())).willReturn(true);
        given(bookingManager.bookInTransaction(any(), any()))
                .willReturn(BookingResult.conflict("overlaps reservation A-00000001"));

        // when & then
        assertThatThrownBy(() -> slotBookingService.bookSlot(command("09:15 AM - 09:45 AM")))
                .isInstanceOf(SlotConflictException.class)
                .hasMessageContaining("A-00000001")
                .extracting("errorCode").isEqualTo(ErrorCode.SLOT_CONFLICT);
        verify(doctorLockRepository).unlock(eq(DOCTOR_ID), anyString());
    }

    @Test
    @DisplayName("저장소 오류는 SLOT_CONFLICT로 바꾸지 않고 그대로 전파하며 락은 해제된다")
    void bookSlot_StorageErrorPropagates() {
        // given
        given(doctorRepository.findByDoctorId(DOCTOR_ID)).willReturn(Optional.of(doctor()));
        given(doctorLockRepository.tryLock(eq(DOCTOR_ID), anyString(), any())).willReturn(true);
        given(bookingManager.bookInTransaction(any(), any()))
                .willThrow(new DataIntegrityViolationException("value too long for column reason"));

        // when & then
        assertThatThrownBy(() -> slotBookingService.bookSlot(command("09:00 AM")))
                .isInstanceOf(DataIntegrityViolationException.class)
                .isNotInstanceOf(SlotConflictException.class);
        verify(doctorLockRepository).unlock(eq(DOCTOR_ID), anyString());
    }

    @Test
    @DisplayName("대기 시간 안에 락을 얻지 못하면 BOOKING_LOCK_TIMEOUT")
    void bookSlot_LockTimeout() {
        // given
        given(doctorRepository.findByDoctorId(DOCTOR_ID)).willReturn(Optional.of(doctor()));
        given(doctorLockRepository.tryLock(eq(DOCTOR_ID), anyString(), any())).willReturn(false);
        given(doctorLockRepository.getStrategyName()).willReturn("local");

        // when & then
        assertThatThrownBy(() -> slotBookingService.bookSlot(command("09:00 AM")))
                .isInstanceOf(BookingLockTimeoutException.class);
        verifyNoInteractions(bookingManager);
        verify(doctorLockRepository, never()).unlock(anyString(), anyString());
    }

    @Test
    @DisplayName("시간대 형식 오류는 저장소 접근 전에 INVALID_INTERVAL")
    void bookSlot_InvalidTimeSlot() {
        assertThatThrownBy(() -> slotBookingService.bookSlot(command("25:00")))
                .isInstanceOf(InvalidIntervalException.class);
        verifyNoInteractions(doctorRepository, doctorLockRepository, bookingManager);
    }

    @Test
    @DisplayName("의사가 없으면 DOCTOR_NOT_FOUND, 락을 시도하지 않는다")
    void bookSlot_DoctorNotFound() {
        // given
        given(doctorRepository.findByDoctorId(DOCTOR_ID)).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> slotBookingService.bookSlot(command("09:00 AM")))
                .isInstanceOf(DoctorNotFoundException.class);
        verifyNoInteractions(doctorLockRepository, bookingManager);
    }

    @Test
    @DisplayName("이메일과 전화번호가 모두 없으면 PATIENT_CONTACT_REQUIRED")
    void bookSlot_ContactRequired() {
        assertThatThrownBy(() -> new BookSlotCommand(
                DOCTOR_ID, "Ravi Kumar", " ", null, "2030-01-07", "09:00 AM", null))
                .isInstanceOf(PatientContactRequiredException.class);
    }

    @Test
    @DisplayName("길이 제한을 넘는 진료 사유는 저장소 접근 전에 INVALID_INPUT")
    void bookSlot_ReasonTooLong() {
        assertThatThrownBy(() -> new BookSlotCommand(DOCTOR_ID, "Ravi Kumar", "ravi@example.com", null,
                "2030-01-07", "09:00 AM", new BookingMetadata("x".repeat(300), null, null, null)))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_INPUT);
        verifyNoInteractions(doctorRepository, doctorLockRepository, bookingManager);
    }

    @Test
    @DisplayName("길이 제한을 넘는 환자 이름은 INVALID_INPUT")
    void bookSlot_PatientNameTooLong() {
        assertThatThrownBy(() -> new BookSlotCommand(DOCTOR_ID, "R".repeat(101), "ravi@example.com", null,
                "2030-01-07", "09:00 AM", null))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("제한 길이와 같은 값은 허용된다")
    void bookSlot_MetadataAtLimit() {
        BookingMetadata metadata = new BookingMetadata("x".repeat(255), "t".repeat(40), "o".repeat(80), "UPI");

        assertThat(metadata.reason()).hasSize(255);
        assertThat(metadata.paymentOrderId()).hasSize(80);
    }

    private static BookSlotCommand command(String timeSlot) {
        return new BookSlotCommand(DOCTOR_ID, "Ravi Kumar", "ravi@example.com", null,
                "2030-01-07", timeSlot, BookingMetadata.defaults());
    }
}
