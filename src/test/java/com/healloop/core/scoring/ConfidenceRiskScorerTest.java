package com.healloop.core.scoring;

import com.healloop.core.autofix.AutoFixProperties;
import com.healloop.core.patch.FileChange;
import com.healloop.core.patch.PatchPlan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceRiskScorerTest {

    private final ConfidenceRiskScorer scorer = new ConfidenceRiskScorer(new AutoFixProperties());

    private static PatchPlan plan(String summary, FileChange... files) {
        return new PatchPlan(summary, "reason", List.of(files), "");
    }

    private static FileChange.Replace replace(String path, String search) {
        return new FileChange.Replace(path, "", search, "x");
    }

    @Nested
    @DisplayName("Confidence")
    class Confidence {

        @Test
        @DisplayName("Base confidence is 0.5")
        void base() {
            assertEquals(0.5, scorer.confidence(plan("Refactor client"), "HTTP 500", 0), 1e-9);
        }

        @Test
        @DisplayName("Error keyword, summary keyword and repeated attempts add up and clip at 1")
        void allSignals() {
            double confidence = scorer.confidence(plan("Add missing header"), "KeyError: 'token'", 5);
            assertEquals(1.0, confidence, 1e-9);
        }

        @Test
        @DisplayName("Each signal only ever raises confidence")
        void monotonic() {
            var plain = plan("Refactor client");
            var keyword = plan("Fix typo in field name");
            double base = scorer.confidence(plain, "boom", 0);
            assertTrue(scorer.confidence(plain, "missing field", 0) > base);
            assertTrue(scorer.confidence(keyword, "boom", 0) > base);
            assertTrue(scorer.confidence(plain, "boom", 3) > base);
            assertEquals(scorer.confidence(plain, "boom", 2), base, 1e-9);
        }

        @Test
        @DisplayName("Null error and plan are tolerated")
        void nulls() {
            assertEquals(0.5, scorer.confidence(null, null, 0), 1e-9);
        }
    }

    @Nested
    @DisplayName("Risk")
    class Risk {

        @Test
        @DisplayName("More than three files is high risk")
        void manyFiles() {
            var p = plan("s",
                    new FileChange.Create("a", "", "x"), new FileChange.Create("b", "", "x"),
                    new FileChange.Create("c", "", "x"), new FileChange.Create("d", "", "x"));
            assertEquals(RiskLevel.HIGH, scorer.risk(p));
        }

        @Test
        @DisplayName("Only new files is low risk, even for a critical name")
        void createsOnly() {
            assertEquals(RiskLevel.LOW, scorer.risk(plan("s", new FileChange.Create("pom.xml", "", "x"))));
        }

        @Test
        @DisplayName("Touching a critical file is high risk")
        void criticalFile() {
            assertEquals(RiskLevel.HIGH, scorer.risk(plan("s",
                    replace("src/main/java/com/healloop/core/engine/ExecutionEngine.java", "import java.util.List;"))));
            assertEquals(RiskLevel.HIGH, scorer.risk(plan("s", new FileChange.Append("pom.xml", "", "x"))));
        }

        @Test
        @DisplayName("A short import replacement is low risk")
        void importReplace() {
            assertEquals(RiskLevel.LOW, scorer.risk(plan("s", replace("src/Client.java", "import java.util.Map;"))));
        }

        @Test
        @DisplayName("Anything else is medium risk")
        void medium() {
            assertEquals(RiskLevel.MEDIUM, scorer.risk(plan("s", replace("src/Client.java", "int limit = 50;"))));
            assertEquals(RiskLevel.MEDIUM, scorer.risk(plan("s", replace("src/Client.java", "import " + "x".repeat(120)))));
        }
    }

    @Test
    @DisplayName("assess combines confidence and risk")
    void assess() {
        FixAssessment assessment = scorer.assess(plan("Add import", replace("src/A.java", "import a.B;")),
                "ImportError: no module", 0);
        assertEquals(1.0, assessment.confidence(), 1e-9);
        assertEquals(RiskLevel.LOW, assessment.riskLevel());
    }
}
