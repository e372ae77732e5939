package org.deeptrace;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ReportJsonTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void threatAssessmentUsesSnakeCase() {
        ThreatAssessment assessment = new ThreatLevelScorer().assess(
                new ModelPrediction(PredictionLabel.FAKE, 95),
                Signal.available(ThreatLevelScorerTest.forensics(30, 20, 30, 70, 20, 60)),
                Signal.unavailable("none"), Signal.unavailable("none"), Signal.unavailable("none"));

        JsonObject json = JsonParser.parseString(ReportJson.toJson(assessment)).getAsJsonObject();

        assertEquals("critical", json.get("level").getAsString());
        assertTrue(json.has("overall_score"));
        assertTrue(json.has("unavailable_components"));
        assertTrue(json.has("risk_factors"));
        assertTrue(json.getAsJsonObject("component_scores").has("model_confidence"));
    }

    @Test
    public void fakeTypeUsesWireValue() {
        FakeTypeResult result = new FakeTypeClassifier().classify(new ModelPrediction(PredictionLabel.FAKE, 80),
                Signal.unavailable("a"),
                Signal.available(ThreatLevelScorerTest.multimodal(70, 30, 40)),
                Signal.unavailable("c"));

        JsonObject json = JsonParser.parseString(ReportJson.toJson(result)).getAsJsonObject();

        assertEquals("lip_sync_manipulation", json.get("primary_type").getAsString());
        assertTrue(json.getAsJsonObject("all_scores").has("gan_face_swap"));
    }

    @Test
    public void failedReportIsWrittenToDisk() throws Exception {
        ExplainabilityReport report = ExplainabilityReport.failed("broken", ModelPrediction.unknown(),
                "Vídeo não encontrado", List.of(), "2024-01-01T00:00", 1.5);

        Path file = ReportJson.write(report, folder.getRoot().toPath().resolve("reports"));

        assertEquals("broken_report.json", file.getFileName().toString());
        JsonObject json = JsonParser.parseString(Files.readString(file, StandardCharsets.UTF_8)).getAsJsonObject();
        assertEquals("Vídeo não encontrado", json.get("error").getAsString());
        assertEquals(50.0, json.get("audio_video_score").getAsDouble(), 0.0);
        assertTrue(json.has("analysis_duration_ms"));
    }
}
