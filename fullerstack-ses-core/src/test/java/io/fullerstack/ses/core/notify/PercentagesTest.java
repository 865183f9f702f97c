package io.fullerstack.ses.core.notify;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PercentagesTest {

    @Test
    void shouldFormatWholePercent() {
        assertThat(Percentages.whole(150.0)).isEqualTo("150%");
        assertThat(Percentages.whole(90)).isEqualTo("90%");
    }

    @Test
    void shouldFormatTwoDecimals() {
        assertThat(Percentages.twoDecimals(3.0)).isEqualTo("3.00%");
        assertThat(Percentages.twoDecimals(0.00001)).isEqualTo("0.00%");
        assertThat(Percentages.twoDecimals(8.125)).isEqualTo("8.13%");
    }
}
