package fr.lapetina.multiprovider.infrastructure.classify;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class PathTemplateClassifierTest {

    private static final String ROOT = "0x" + "ab".repeat(32);

    private PathTemplateClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new PathTemplateClassifier();
    }

    @ParameterizedTest
    @CsvSource({
            "/eth/v1/beacon/blocks/12345, /eth/v1/beacon/blocks/{block_id}",
            "/eth/v2/beacon/blocks/head, /eth/v2/beacon/blocks/{block_id}",
            "/eth/v1/beacon/blob_sidecars/finalized, /eth/v1/beacon/blob_sidecars/{block_id}",
            "/eth/v3/validator/blocks/12345, /eth/v3/validator/blocks/{slot}",
            "/eth/v1/beacon/states/head/finality_checkpoints, /eth/v1/beacon/states/{state_id}/finality_checkpoints",
            "/eth/v1/validator/duties/attester/123, /eth/v1/validator/duties/attester/{epoch}",
            "/eth/v1/validator/duties/proposer/7, /eth/v1/validator/duties/proposer/{epoch}",
            "/eth/v1/beacon/states/head/committees/3, /eth/v1/beacon/states/{state_id}/committees/{committee_index}",
            "/eth/v1/node/peers/16Uiu2HAm, /eth/v1/node/peers/{peer_id}",
            "/eth/v1/node/health, /eth/v1/node/health",
            "/eth/v1/node/version, /eth/v1/node/version"
    })
    @DisplayName("should template identifiers in Beacon API paths")
    void shouldTemplatePaths(String path, String expected) {
        assertThat(classifier.classify(path)).contains(expected);
    }

    @Test
    @DisplayName("should template state and validator identifiers")
    void shouldTemplateStateAndValidator() {
        assertThat(classifier.classify("/eth/v1/beacon/states/head/validators/" + ROOT))
                .contains("/eth/v1/beacon/states/{state_id}/validators/{validator_id}");
    }

    @Test
    @DisplayName("should template block root after bootstrap")
    void shouldTemplateBootstrapRoot() {
        assertThat(classifier.classify("/eth/v1/beacon/light_client/bootstrap/" + ROOT))
                .contains("/eth/v1/beacon/light_client/bootstrap/{block_root}");
    }

    @Test
    @DisplayName("should fall back to generic numeric and root placeholders")
    void shouldUseGenericPlaceholders() {
        assertThat(classifier.classify("/custom/42/" + ROOT)).contains("/custom/{id}/{root}");
    }

    @Test
    @DisplayName("should keep non-numeric epoch segment literal")
    void shouldKeepNonNumericEpoch() {
        assertThat(classifier.classify("/eth/v1/validator/duties/sync"))
                .contains("/eth/v1/validator/duties/sync");
    }

    @Test
    @DisplayName("should drop query string and fragment")
    void shouldDropQuery() {
        assertThat(classifier.classify("/eth/v1/beacon/blocks/123?foo=bar#x"))
                .contains("/eth/v1/beacon/blocks/{block_id}");
    }

    @Test
    @DisplayName("should accept full URLs")
    void shouldAcceptFullUrl() {
        assertThat(classifier.classify("http://127.0.0.1:5052/eth/v1/beacon/headers/100"))
                .contains("/eth/v1/beacon/headers/{id}");
    }

    @Test
    @DisplayName("should be idempotent")
    void shouldBeIdempotent() {
        String template = classifier.classify("/eth/v1/beacon/states/head/committees/3").orElseThrow();

        assertThat(classifier.classify(template)).contains(template);
    }

    @Test
    @DisplayName("should return empty for unparsable input")
    void shouldReturnEmptyForUnparsable() {
        assertThat(classifier.classify("http://exa mple.com/x")).isEmpty();
        assertThat(classifier.classify("")).isEmpty();
        assertThat(classifier.classify(null)).isEmpty();
    }
}
