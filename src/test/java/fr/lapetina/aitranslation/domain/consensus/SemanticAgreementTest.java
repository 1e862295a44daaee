package fr.lapetina.aitranslation.domain.consensus;

import fr.lapetina.aitranslation.domain.exception.EmbeddingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SemanticAgreementTest {

    private static final Map<String, float[]> VECTORS = Map.of(
            "x", new float[]{1, 0},
            "y", new float[]{0, 1},
            "x2", new float[]{2, 0},
            "minus-x", new float[]{-1, 0});

    private final SemanticAgreement agreement = new SemanticAgreement(VECTORS::get);

    @Test
    @DisplayName("should be zero for fewer than two texts")
    void shouldBeZeroForSingleText() {
        assertThat(agreement.measure(List.of("x"))).isZero();
        assertThat(agreement.measure(List.of())).isZero();
    }

    @Test
    @DisplayName("should be one for parallel vectors")
    void shouldBeOneForParallel() {
        assertThat(agreement.measure(List.of("x", "x2"))).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("should average pairwise similarities")
    void shouldAveragePairs() {
        // pairs: (x,x2)=1, (x,y)=0, (x2,y)=0
        assertThat(agreement.measure(List.of("x", "x2", "y"))).isCloseTo(1.0 / 3, within(1e-9));
    }

    @Test
    @DisplayName("should clamp negative similarity to zero")
    void shouldClampNegative() {
        assertThat(agreement.measure(List.of("x", "minus-x"))).isZero();
    }

    @Test
    @DisplayName("should treat zero vectors as dissimilar")
    void shouldHandleZeroVector() {
        assertThat(SemanticAgreement.cosine(new float[]{0, 0}, new float[]{1, 0})).isZero();
    }

    @Test
    @DisplayName("should reject vectors of different dimensions")
    void shouldRejectDimensionMismatch() {
        assertThatThrownBy(() -> SemanticAgreement.cosine(new float[]{1}, new float[]{1, 0}))
                .isInstanceOf(EmbeddingException.class);
    }
}
