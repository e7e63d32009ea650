package org.asymptote.export;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.asymptote.compiler.analysis.RoutineAnalysis;
import org.asymptote.compiler.diagnostics.Diagnostic;
import org.asymptote.patterns.AlgorithmMatch;
import org.asymptote.pipeline.AnalysisReport;
import org.asymptote.validation.BoundComparison;
import org.asymptote.validation.ComparisonResult;

/**
 * Serializes an {@link AnalysisReport} to JSON for API and CLI consumers.
 */
public class ReportJsonWriter {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    /**
     * @param report     The report.
     * @param includeAst Whether to embed the annotated AST.
     * @return pretty-printed JSON.
     */
    public String toJson(AnalysisReport report, boolean includeAst) {
        return gson.toJson(toJsonTree(report, includeAst));
    }

    public JsonObject toJsonTree(AnalysisReport report, boolean includeAst) {
        JsonObject json = new JsonObject();
        json.addProperty("fingerprint", report.fingerprint());
        json.addProperty("tokens", report.tokenCount());
        json.add("complexity", AstJsonWriter.complexity(report.complexity()));

        JsonArray routines = new JsonArray();
        for (RoutineAnalysis routine : report.result().routines()) {
            JsonObject r = new JsonObject();
            r.addProperty("name", routine.name());
            r.add("complexity", AstJsonWriter.complexity(routine.complexity()));
            routine.recurrenceDescriptor().ifPresent(d -> r.addProperty("recurrence", d.render()));
            routine.recurrenceSolution().ifPresent(s -> {
                r.addProperty("case", s.recurrenceCase().name());
                r.addProperty("explanation", s.explanation());
            });
            routines.add(r);
        }
        json.add("routines", routines);

        JsonArray diagnostics = new JsonArray();
        for (Diagnostic diagnostic : report.diagnostics()) {
            JsonObject d = new JsonObject();
            d.addProperty("severity", diagnostic.severity().name());
            d.addProperty("code", diagnostic.code());
            d.addProperty("message", diagnostic.message());
            d.addProperty("line", diagnostic.line());
            d.addProperty("column", diagnostic.column());
            diagnostics.add(d);
        }
        json.add("diagnostics", diagnostics);

        report.algorithmHint().ifPresent(hint -> json.add("algorithmHint", hint(hint)));
        report.validation().ifPresent(comparison -> json.add("validation", validation(comparison)));
        if (includeAst) {
            json.add("ast", new AstJsonWriter(report.result()).write(report.ast()));
        }
        return json;
    }

    private static JsonObject hint(AlgorithmMatch match) {
        JsonObject json = new JsonObject();
        json.addProperty("id", match.pattern().id());
        json.addProperty("name", match.pattern().name());
        json.addProperty("strategy", match.pattern().strategy());
        json.addProperty("expectedComplexity", match.pattern().expectedComplexity());
        json.addProperty("hits", match.hits());
        return json;
    }

    private static JsonObject validation(ComparisonResult comparison) {
        JsonObject json = new JsonObject();
        json.addProperty("agreementScore", comparison.agreementScore());
        json.addProperty("allMatch", comparison.allMatch());
        JsonArray details = new JsonArray();
        for (BoundComparison detail : comparison.details()) {
            JsonObject d = new JsonObject();
            d.addProperty("bound", detail.bound());
            d.addProperty("deterministic", detail.deterministic());
            d.addProperty("external", detail.external());
            d.addProperty("match", detail.match());
            details.add(d);
        }
        json.add("details", details);
        json.addProperty("explanation", comparison.explanation());
        return json;
    }
}
