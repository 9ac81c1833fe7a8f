package io.mnemo.core.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class HashingEmbeddingProviderTest {

    private final HashingEmbeddingProvider provider = new HashingEmbeddingProvider();

    @Test
    void shouldProduceUnitLengthDenseVectorOfConfiguredSize() {
        float[] vector = provider.embedDense("Prefers morning workouts and green tea");

        assertThat(vector).hasSize(HashingEmbeddingProvider.DEFAULT_DIMENSIONS);
        double norm = 0.0;
        for (float value : vector) {
            norm += value * value;
        }
        assertThat(Math.sqrt(norm)).isCloseTo(1.0, within(1e-5));
    }

    @Test
    void shouldBeDeterministic() {
        assertThat(provider.embedDense("sleep schedule")).containsExactly(provider.embedDense("sleep schedule"));
        assertThat(provider.embedSparse("sleep schedule")).isEqualTo(provider.embedSparse("sleep schedule"));
    }

    @Test
    void shouldReturnZeroVectorsForBlankOrStopWordOnlyText() {
        assertThat(provider.embedDense("")).containsOnly(0.0f);
        assertThat(provider.embedDense("the and of")).containsOnly(0.0f);
        assertThat(provider.embedSparse("   ").isEmpty()).isTrue();
    }

    @Test
    void shouldWeightRepeatedTermsLogarithmically() {
        SparseVector sparse = provider.embedSparse("coffee coffee tea");

        assertThat(sparse.size()).isEqualTo(2);
        int coffee = "coffee".hashCode() & Integer.MAX_VALUE;
        for (int i = 0; i < sparse.size(); i++) {
            float expected = sparse.indices()[i] == coffee ? (float) (1.0 + Math.log(2)) : 1.0f;
            assertThat(sparse.values()[i]).isEqualTo(expected);
        }
    }

    @Test
    void shouldIgnoreCaseAndPunctuation() {
        assertThat(provider.embedSparse("Health, HEALTH!")).isEqualTo(provider.embedSparse("health health"));
    }

    @Test
    void shouldRejectNonPositiveDimensions() {
        assertThatThrownBy(() -> new HashingEmbeddingProvider(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldReportModelId() {
        assertThat(new HashingEmbeddingProvider(64).modelId()).isEqualTo("hashing/64");
        assertThat(new HashingEmbeddingProvider(64).dimensions()).isEqualTo(64);
    }
}
