package personal.clinic.appointment.scheduling.adapter.in.seed;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.clinic.appointment.scheduling.support.InMemorySchedulingStore;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static personal.clinic.appointment.scheduling.support.SchedulingFixtures.doctor;

@DisplayName("DoctorSeedInitializer 단위 테스트")
class DoctorSeedInitializerTest {

    @Test
    @DisplayName("등록되지 않은 데모 의사만 저장한다")
    void seedsMissingDoctorsOnly() {
        // given
        InMemorySchedulingStore store = new InMemorySchedulingStore();
        store.save(doctor());
        DoctorSeedInitializer initializer = new DoctorSeedInitializer(store);

        // when
        initializer.seedDoctors();

        // then
        assertThat(store.findByDoctorId("D001")).hasValueSatisfying(d -> assertThat(d.id()).isEqualTo(1L));
        assertThat(store.existsByDoctorId("D002")).isTrue();
        assertThat(store.existsByDoctorId("D003")).isTrue();
    }

    @Test
    @DisplayName("D002는 토요일에도 진료하고 일요일은 휴진이다")
    void saturdayClinicWindow() {
        // given
        LocalDate saturday = LocalDate.of(2030, 1, 5);
        LocalDate sunday = LocalDate.of(2030, 1, 6);

        // when & then
        assertThat(DoctorSeedInitializer.seedData())
                .filteredOn(d -> d.doctorId().equals("D002"))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.windowOn(saturday).isOpen()).isTrue();
                    assertThat(d.windowOn(sunday).isOpen()).isFalse();
                });
    }
}
