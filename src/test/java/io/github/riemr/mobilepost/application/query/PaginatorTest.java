package io.github.riemr.mobilepost.application.query;

import io.github.riemr.mobilepost.application.dto.PageMeta;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PaginatorTest {

    @Test
    void meta_computesTotalPagesByCeiling() {
        PageMeta meta = Paginator.meta(72, new PageWindow(2, 20));

        assertThat(meta.getTotal()).isEqualTo(72);
        assertThat(meta.getPage()).isEqualTo(2);
        assertThat(meta.getLimit()).isEqualTo(20);
        assertThat(meta.getTotalPages()).isEqualTo(4);
    }

    @Test
    void totalPages_isZero_whenNothingMatches() {
        assertThat(Paginator.totalPages(0, 20)).isZero();
        assertThat(Paginator.totalPages(20, 20)).isEqualTo(1);
        assertThat(Paginator.totalPages(21, 20)).isEqualTo(2);
    }

    @Test
    void window_offsetIsPageMinusOneTimesLimit() {
        assertThat(Paginator.window(3, 25).getValue().offset()).isEqualTo(50);
        assertThat(Paginator.window(0, 25).isValid()).isFalse();
    }
}
