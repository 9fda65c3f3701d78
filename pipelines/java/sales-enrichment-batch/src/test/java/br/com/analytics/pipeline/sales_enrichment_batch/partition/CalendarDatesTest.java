package br.com.analytics.pipeline.sales_enrichment_batch.partition;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class CalendarDatesTest {

    @Test
    void ignoresTimeOfDayAndNanoseconds() {
        assertThat(CalendarDates.parse("2025-10-15 01:45:02.183151148")).contains(LocalDate.of(2025, 10, 15));
        assertThat(CalendarDates.parse("2025-01-05T23:59:59+09:00")).contains(LocalDate.of(2025, 1, 5));
        assertThat(CalendarDates.parse("2025-01-05")).contains(LocalDate.of(2025, 1, 5));
    }

    @Test
    void acceptsLeapDay() {
        assertThat(CalendarDates.parse("2024-02-29 12:00:00")).contains(LocalDate.of(2024, 2, 29));
    }

    @ParameterizedTest
    @ValueSource(strings = {"2025-02-30 10:00:00", "2023-02-29", "2025-13-01", "2025-1-5", "20250105", "", "garbage-in"})
    void rejectsTimestampsWithoutValidDate(String timestamp) {
        assertThat(CalendarDates.parse(timestamp)).isEmpty();
    }

    @Test
    void rejectsNull() {
        assertThat(CalendarDates.parse(null)).isEmpty();
    }
}
