package com.shopsense.common.enums;

import org.junit.jupiter.api.Test;

import java.time.Month;

import static org.assertj.core.api.Assertions.assertThat;

class SeasonTest {

    @Test
    void mapsMonthsToSeasons() {
        assertThat(Season.of(Month.MARCH)).isEqualTo(Season.SPRING);
        assertThat(Season.of(Month.MAY)).isEqualTo(Season.SPRING);
        assertThat(Season.of(Month.JUNE)).isEqualTo(Season.SUMMER);
        assertThat(Season.of(Month.AUGUST)).isEqualTo(Season.SUMMER);
        assertThat(Season.of(Month.SEPTEMBER)).isEqualTo(Season.FALL);
        assertThat(Season.of(Month.NOVEMBER)).isEqualTo(Season.FALL);
        assertThat(Season.of(Month.DECEMBER)).isEqualTo(Season.WINTER);
        assertThat(Season.of(Month.FEBRUARY)).isEqualTo(Season.WINTER);
    }

    @Test
    void parsesAttributeValuesLeniently() {
        assertThat(Season.fromName(" Summer ")).contains(Season.SUMMER);
        assertThat(Season.fromName("autumn")).contains(Season.FALL);
        assertThat(Season.fromName("monsoon")).isEmpty();
        assertThat(Season.fromName(null)).isEmpty();
    }
}
