package io.clusterprobe.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static io.clusterprobe.config.Constants.GLOBAL_LOCUS;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for Result and ExpectedResult models.
 */
class ResultTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testBlankLocusIsGlobal() {
        Result result = Result.builder().producer("e2e").locus(" ").kind("junit").build();

        assertThat(result.getLocus()).isEqualTo(GLOBAL_LOCUS);
        assertThat(result.key()).isEqualTo(ExpectedResult.global("e2e", "junit"));
        assertThat(result.key().isGlobal()).isTrue();
    }

    @Test
    void testKeyMatchesExpectedSlot() {
        Result result = Result.builder().producer("systemd-logs").locus("node-1").kind("logs").build();

        assertThat(result.key()).isEqualTo(ExpectedResult.forNode("systemd-logs", "node-1", "logs"));
        assertThat(result.key()).isNotEqualTo(ExpectedResult.forNode("systemd-logs", "node-2", "logs"));
    }

    @Test
    void testErrorMarksResultFailed() {
        assertThat(Result.builder().producer("e2e").kind("junit").error("boom").build().isFailed()).isTrue();
        assertThat(Result.builder().producer("e2e").kind("junit").error("").build().isFailed()).isFalse();
        assertThat(Result.builder().producer("e2e").kind("junit").build().isFailed()).isFalse();
    }

    @Test
    void testPayloadIsCopied() {
        ObjectNode payload = objectMapper.createObjectNode().put("passed", 3);
        Result result = Result.builder().producer("e2e").kind("junit").payload(payload).build();

        payload.put("passed", 0);
        ((ObjectNode) result.getPayload()).put("passed", 1);

        assertThat(result.getPayload().get("passed").asInt()).isEqualTo(3);
    }

    @Test
    void testProducerAndKindRequired() {
        assertThatThrownBy(() -> Result.builder().kind("junit").build()).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Result.builder().producer("e2e").build()).isInstanceOf(NullPointerException.class);
    }

    @Test
    void testJsonOmitsMissingError() throws Exception {
        Result result = Result.builder().producer("e2e").kind("junit")
            .payload(objectMapper.createObjectNode().put("passed", true)).build();

        JsonNode json = objectMapper.valueToTree(result);

        assertThat(json.get("producer").asText()).isEqualTo("e2e");
        assertThat(json.get("locus").asText()).isEqualTo(GLOBAL_LOCUS);
        assertThat(json.get("payload").get("passed").asBoolean()).isTrue();
        assertThat(json.has("error")).isFalse();
        assertThat(json.has("failed")).isFalse();
    }

    @Test
    void testExpectedResultJsonRoundTrip() throws Exception {
        ExpectedResult expected = ExpectedResult.forNode("systemd-logs", "node-1", "logs");

        ExpectedResult parsed = objectMapper.readValue(objectMapper.writeValueAsString(expected), ExpectedResult.class);

        assertThat(parsed).isEqualTo(expected);
    }
}
