/* (C)2026 */
package com.ammann.dip.statistics;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SeriesEdgeTest {

    @ParameterizedTest
    @CsvSource({"9,10,true", "7,10,true", "6,10,false", "0,1,true"})
    void liveEdgeCoversLastThreeSamples(int end, int length, boolean expected) {
        assertThat(SeriesEdge.isLiveEdge(end, length)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"9,10,true", "8,10,true", "7,10,false"})
    void tailMinimumCoversLastTwoSamples(int index, int length, boolean expected) {
        assertThat(SeriesEdge.isTailMinimum(index, length)).isEqualTo(expected);
    }
}
