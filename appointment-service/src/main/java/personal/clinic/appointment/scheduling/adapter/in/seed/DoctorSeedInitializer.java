package personal.clinic.appointment.scheduling.adapter.in.seed;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import personal.clinic.appointment.scheduling.application.port.out.DoctorRepository;
import personal.clinic.appointment.scheduling.domain.model.Doctor;
import personal.clinic.appointment.scheduling.domain.model.WorkingWindow;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Doctor Seed Initializer
 * 로컬/데모 환경용 의사 데이터 등록
 * <p>
 * WARNING: appointment.seed.enabled=true 일 때만 동작 - 프로덕션에서 비활성화 필요
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "appointment.seed", name = "enabled", havingValue = "true")
public class DoctorSeedInitializer {

    private final DoctorRepository doctorRepository;

    @EventListener(ApplicationReadyEvent.class)
    public void seedDoctors() {
        int created = 0;
        for (Doctor doctor : seedData()) {
            if (doctorRepository.existsByDoctorId(doctor.doctorId())) {
                continue;
            }
            doctorRepository.save(doctor);
            created++;
        }
        log.info("Doctor seed completed: created={}", created);
    }

    static List<Doctor> seedData() {
        Map<DayOfWeek, WorkingWindow> weekdays = weekly(LocalTime.of(9, 0), LocalTime.of(17, 0), false);
        Map<DayOfWeek, WorkingWindow> withSaturday = weekly(LocalTime.of(10, 0), LocalTime.of(14, 0), true);

        return List.of(
                new Doctor(null, "D001", "Anjali Mehta", "anjali.mehta@clinic.local", "+91-9000000001",
                        "Cardiology", "MBBS, MD (Cardiology)", 12, new BigDecimal("800"), 4.8,
                        null, "Asia/Kolkata", true, weekdays),
                new Doctor(null, "D002", "Rahul Verma", "rahul.verma@clinic.local", "+91-9000000002",
                        "Dermatology", "MBBS, MD (Dermatology)", 8, new BigDecimal("600"), 4.6,
                        null, "Asia/Kolkata", true, withSaturday),
                new Doctor(null, "D003", "Sara Iyer", "sara.iyer@clinic.local", "+91-9000000003",
                        "Pediatrics", "MBBS, DCH", 15, new BigDecimal("700"), 4.9,
                        null, "Asia/Kolkata", true, weekdays));
    }

    private static Map<DayOfWeek, WorkingWindow> weekly(LocalTime start, LocalTime end, boolean saturday) {
        Map<DayOfWeek, WorkingWindow> windows = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            boolean working = day.getValue() <= 5 || (saturday && day == DayOfWeek.SATURDAY);
            windows.put(day, working ? WorkingWindow.of(start, end) : WorkingWindow.closed());
        }
        return windows;
    }
}
