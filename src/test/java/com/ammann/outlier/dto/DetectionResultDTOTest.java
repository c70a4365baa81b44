/* (C)2026 */
package com.ammann.outlier.dto;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.outlier.detection.EnsembleMethod;
import com.ammann.outlier.detection.IqrMethod;
import com.ammann.outlier.detection.ZScoreMethod;
import com.ammann.outlier.support.TestDataFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class DetectionResultDTOTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void ensembleResultCarriesVotingFieldsAndVoterBreakdown() {
        DetectionResultDTO dto =
                DetectionResultDTO.from(new EnsembleMethod().detect(TestDataFactory.spikedSeries()));

        assertThat(dto.method()).isEqualTo("ensemble");
        assertThat(dto.status()).isEqualTo("COMPLETED");
        assertThat(dto.consensusVotesNeeded()).isEqualTo(2);
        assertThat(dto.methodsUsed()).containsExactly("zscore", "iqr", "modified_zscore", "mad");
        assertThat(dto.individualResults().get("zscore").sampleScores()).hasSize(13);
        assertThat(dto.sampleScores()).isNull();
    }

    @Test
    void singleMethodOmitsEnsembleFieldsInJson() throws Exception {
        DetectionResultDTO dto =
                DetectionResultDTO.from(new ZScoreMethod().detect(TestDataFactory.spikedSeries()));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(dto));

        assertThat(json.get("method").asText()).isEqualTo("zscore");
        assertThat(json.has("votes")).isFalse();
        assertThat(json.has("individualResults")).isFalse();
        assertThat(json.get("outlierIndices").get(0).asInt()).isEqualTo(8);
        assertThat(json.get("diagnostics").get("mean").asDouble()).isEqualTo(34.0);
    }

    @Test
    void methodWithoutPerSampleScoresOmitsThem() {
        DetectionResultDTO dto =
                DetectionResultDTO.from(new IqrMethod().detect(TestDataFactory.spikedSeries()));

        assertThat(dto.sampleScores()).isNull();
        assertThat(dto.diagnostics()).containsKeys("q1", "q3", "lower_bound", "upper_bound");
    }
}
