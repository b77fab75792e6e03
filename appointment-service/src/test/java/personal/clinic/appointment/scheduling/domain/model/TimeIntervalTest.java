package personal.clinic.appointment.scheduling.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.clinic.appointment.scheduling.domain.exception.InvalidIntervalException;

import java.time.Duration;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static personal.clinic.appointment.scheduling.support.SchedulingFixtures.MONDAY;
import static personal.clinic.appointment.scheduling.support.SchedulingFixtures.OFFSET;
import static personal.clinic.appointment.scheduling.support.SchedulingFixtures.at;
import static personal.clinic.appointment.scheduling.support.SchedulingFixtures.interval;

@DisplayName("TimeInterval 단위 테스트")
class TimeIntervalTest {

    @Test
    @DisplayName("맞닿은 구간은 겹치지 않는다")
    void touchingIntervalsDoNotOverlap() {
        // given
        TimeInterval morning = interval(9, 0, 9, 30);
        TimeInterval next = interval(9, 30, 10, 0);

        // when & then
        assertThat(morning.overlaps(next)).isFalse();
        assertThat(next.overlaps(morning)).isFalse();
    }

    @Test
    @DisplayName("일부만 겹쳐도 겹침으로 판단한다")
    void partialOverlapIsOverlap() {
        // given
        TimeInterval booked = interval(9, 0, 9, 30);
        TimeInterval requested = interval(9, 15, 9, 45);

        // when & then
        assertThat(booked.overlaps(requested)).isTrue();
        assertThat(requested.overlaps(booked)).isTrue();
    }

    @Test
    @DisplayName("다른 오프셋으로 표현된 같은 시각도 절대 시간으로 비교한다")
    void comparesAbsoluteInstants() {
        // given: 09:00+05:30 == 03:30Z
        TimeInterval local = interval(9, 0, 9, 30);
        TimeInterval utc = TimeInterval.of(
                at(9, 0).withOffsetSameInstant(ZoneOffset.UTC),
                at(9, 30).withOffsetSameInstant(ZoneOffset.UTC));

        // when & then
        assertThat(local).isEqualTo(utc);
        assertThat(local.overlaps(utc)).isTrue();
    }

    @Test
    @DisplayName("시작이 종료보다 늦거나 같으면 INVALID_INTERVAL")
    void rejectsEmptyOrReversedInterval() {
        assertThatThrownBy(() -> interval(10, 0, 10, 0))
                .isInstanceOf(InvalidIntervalException.class);
        assertThatThrownBy(() -> interval(10, 0, 9, 0))
                .isInstanceOf(InvalidIntervalException.class)
                .hasMessageContaining("start must be before end");
    }

    @Test
    @DisplayName("하루 구간은 자정부터 다음 날 자정까지 24시간")
    void dayIntervalCoversWholeDay() {
        // when
        TimeInterval day = TimeInterval.ofDay(MONDAY, OFFSET);

        // then
        assertThat(day.duration()).isEqualTo(Duration.ofHours(24));
        assertThat(day.startAt(OFFSET)).isEqualTo(MONDAY.atStartOfDay().atOffset(OFFSET));
        assertThat(day.contains(interval(23, 30, 23, 59))).isTrue();
    }
}
