package org.asymptote.pipeline;

import com.typesafe.config.Config;
import org.asymptote.compiler.analysis.AnalysisResult;
import org.asymptote.compiler.analysis.ComplexityAnalyzer;
import org.asymptote.compiler.api.AnalysisContext;
import org.asymptote.compiler.api.AnalysisException;
import org.asymptote.compiler.frontend.lexer.Lexer;
import org.asymptote.compiler.frontend.parser.Parser;
import org.asymptote.compiler.frontend.parser.ast.SequenceNode;
import org.asymptote.compiler.model.Token;
import org.asymptote.patterns.AlgorithmMatch;
import org.asymptote.patterns.AlgorithmPatternMatcher;
import org.asymptote.validation.ComparisonResult;
import org.asymptote.validation.ComplexityComparator;
import org.asymptote.validation.ExternalJudgement;
import org.asymptote.validation.ValidationCollaborator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Runs one request through lexer, parser and analyzer, strictly in that order, and packs
 * the outcome into an {@link AnalysisReport}.
 * <p>
 * Lexical, syntax and budget failures abort the request with an {@link AnalysisException}.
 * The optional collaborators only add information: the pattern matcher attaches a
 * known-algorithm hint, the validation collaborator an agreement comparison. A failing
 * collaborator is logged and ignored. The pipeline holds no per-request state and may be
 * shared between threads.
 */
public class ComplexityPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(ComplexityPipeline.class);

    private final AnalysisCache cache;
    private final AlgorithmPatternMatcher patternMatcher;
    private final ValidationCollaborator validator;
    private final ComplexityComparator comparator = new ComplexityComparator();

    /**
     * @param cache          Cross-request cache, or null to disable caching.
     * @param patternMatcher Known-algorithm matcher, or null to disable hints.
     * @param validator      External validation collaborator, or null.
     */
    public ComplexityPipeline(AnalysisCache cache, AlgorithmPatternMatcher patternMatcher, ValidationCollaborator validator) {
        this.cache = cache;
        this.patternMatcher = patternMatcher;
        this.validator = validator;
    }

    /**
     * A pipeline without cache, hints or validation.
     */
    public ComplexityPipeline() {
        this(null, null, null);
    }

    /**
     * Builds a pipeline from the {@code asymptote} block: the cache when
     * {@code cache.enabled} is true, and the pattern catalog.
     */
    public static ComplexityPipeline fromConfig(Config options, ValidationCollaborator validator) {
        AnalysisCache cache = null;
        if (options.hasPath("cache") && options.getBoolean("cache.enabled")) {
            cache = AnalysisCache.fromConfig(options.getConfig("cache"));
        }
        return new ComplexityPipeline(cache, AlgorithmPatternMatcher.fromConfig(options), validator);
    }

    public Optional<AnalysisCache> cache() {
        return Optional.ofNullable(cache);
    }

    /**
     * Analyzes with default options.
     */
    public AnalysisReport analyze(String source) {
        return analyze(source, AnalysisContext.defaults());
    }

    /**
     * Analyzes one source text.
     *
     * @param source  The pseudocode.
     * @param context The request context with options, budget and cancellation signal.
     * @return the report.
     * @throws AnalysisException on lexical, syntax, budget or cancellation failures.
     */
    public AnalysisReport analyze(String source, AnalysisContext context) {
        context.checkpoint("start");
        String fingerprint = fingerprint(source);
        AnalysisCache.Key key = new AnalysisCache.Key(fingerprint, context.options());

        AnalysisReport report = cache != null ? cache.get(key).orElse(null) : null;
        if (report != null) {
            LOG.debug("Cache hit for {}", fingerprint);
        } else {
            report = compute(source, fingerprint, context);
            if (cache != null) {
                cache.put(key, report);
            }
        }
        return validate(source, report);
    }

    private AnalysisReport compute(String source, String fingerprint, AnalysisContext context) {
        long start = System.nanoTime();
        List<Token> tokens = new Lexer(source, context).scanTokens();
        long lexed = System.nanoTime();
        SequenceNode ast = new Parser(tokens, context).parse();
        long parsed = System.nanoTime();
        AnalysisResult result = new ComplexityAnalyzer(context).analyze(ast);
        long analyzed = System.nanoTime();
        LOG.debug("Pipeline timings: lex={}ms, parse={}ms, analyze={}ms",
                (lexed - start) / 1_000_000, (parsed - lexed) / 1_000_000, (analyzed - parsed) / 1_000_000);

        AlgorithmMatch hint = patternMatcher != null ? patternMatcher.match(source).orElse(null) : null;
        return new AnalysisReport(fingerprint, tokens.size() - 1, ast, result, hint, null);
    }

    private AnalysisReport validate(String source, AnalysisReport report) {
        if (validator == null) {
            return report;
        }
        try {
            ExternalJudgement judgement = validator.judge(source, report.complexity());
            if (judgement == null) {
                return report;
            }
            ComparisonResult comparison = comparator.compare(report.complexity(), judgement);
            return report.withValidation(comparison);
        } catch (RuntimeException e) {
            LOG.warn("Validation collaborator failed, continuing without validation: {}", e.getMessage());
            return report;
        }
    }

    /**
     * @return the lower-case hex SHA-256 of the UTF-8 source text.
     */
    public static String fingerprint(String source) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(source.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
