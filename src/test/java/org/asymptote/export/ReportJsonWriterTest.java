package org.asymptote.export;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.asymptote.pipeline.AnalysisReport;
import org.asymptote.pipeline.ComplexityPipeline;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ReportJsonWriterTest {

    private static final String BINARY_SEARCH = """
            FUNCTION Search(A, x, n)
                IF n ≤ 1 THEN
                    RETURN 0
                END IF
                CALL Search(A, x, n DIV 2)
            END FUNCTION
            """;

    private final ReportJsonWriter writer = new ReportJsonWriter();

    @Test
    void writesBoundsRoutinesAndDiagnostics() {
        AnalysisReport report = new ComplexityPipeline().analyze(BINARY_SEARCH);

        JsonObject json = JsonParser.parseString(writer.toJson(report, false)).getAsJsonObject();

        assertThat(json.get("fingerprint").getAsString()).isEqualTo(report.fingerprint());
        JsonObject complexity = json.getAsJsonObject("complexity");
        assertThat(complexity.get("O").getAsString()).isEqualTo("O(log n)");
        assertThat(complexity.get("Omega").getAsString()).isEqualTo("Ω(log n)");
        assertThat(complexity.get("Theta").getAsString()).isEqualTo("Θ(log n)");

        JsonObject routine = json.getAsJsonArray("routines").get(0).getAsJsonObject();
        assertThat(routine.get("name").getAsString()).isEqualTo("Search");
        assertThat(routine.get("recurrence").getAsString()).isEqualTo("T(n) = T(n/2) + 1");
        assertThat(routine.get("case").getAsString()).isEqualTo("MASTER_CASE_2");

        assertThat(json.getAsJsonArray("diagnostics")).isEmpty();
        assertThat(json.has("ast")).isFalse();
        assertThat(json.has("validation")).isFalse();
    }

    @Test
    void embedsTheAnnotatedAstOnRequest() {
        AnalysisReport report = new ComplexityPipeline().analyze("""
                x ← y
                FOR i ← 1 TO n DO
                    x ← x + A[i]
                END FOR
                """);

        JsonObject json = writer.toJsonTree(report, true);

        JsonObject ast = json.getAsJsonObject("ast");
        assertThat(ast.get("kind").getAsString()).isEqualTo("Sequence");
        JsonObject loop = ast.getAsJsonArray("statements").get(1).getAsJsonObject();
        assertThat(loop.get("kind").getAsString()).isEqualTo("Loop");
        assertThat(loop.get("loopKind").getAsString()).isEqualTo("FOR");
        assertThat(loop.getAsJsonObject("complexity").get("Theta").getAsString()).isEqualTo("Θ(n)");
        assertThat(loop.get("line").getAsInt()).isEqualTo(2);

        JsonObject diagnostic = json.getAsJsonArray("diagnostics").get(0).getAsJsonObject();
        assertThat(diagnostic.get("code").getAsString()).isEqualTo("undefined-variable");
        assertThat(diagnostic.get("severity").getAsString()).isEqualTo("ERROR");
        assertThat(diagnostic.get("line").getAsInt()).isEqualTo(1);
    }
}
