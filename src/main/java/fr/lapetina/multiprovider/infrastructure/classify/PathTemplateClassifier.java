package fr.lapetina.multiprovider.infrastructure.classify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Collapses a Beacon API path with embedded identifiers into a bounded-cardinality template.
 *
 * Each segment is checked against an ordered rule catalog, most specific first; the first
 * matching rule wins. Rules only look at the original (literal) preceding segments.
 *
 * <pre>
 * /eth/v1/beacon/blocks/12345          -> /eth/v1/beacon/blocks/{block_id}
 * /eth/v3/validator/blocks/12345       -> /eth/v3/validator/blocks/{slot}
 * /eth/v1/beacon/states/head/validators/0xab..  -> /eth/v1/beacon/states/{state_id}/validators/{validator_id}
 * </pre>
 *
 * Never throws: a path that cannot be parsed yields {@link Optional#empty()}.
 */
public final class PathTemplateClassifier {

    private static final Logger log = LoggerFactory.getLogger(PathTemplateClassifier.class);

    private static final List<PathRule> DEFAULT_RULES = List.of(
            new PathRule("placeholder", ctx -> PathRule.isPlaceholder(ctx.segment()), null),
            PathRule.afterPair("validator", "blocks", "{slot}"),
            PathRule.after(Set.of("blocks", "blinded_blocks", "blob_sidecars"), "{block_id}"),
            PathRule.after(Set.of("states"), "{state_id}"),
            PathRule.after(Set.of("validators"), "{validator_id}"),
            new PathRule(
                    "epoch",
                    ctx -> Set.of("duties", "attester", "proposer", "sync", "liveness", "attestations")
                            .contains(ctx.previous()) && PathRule.isNumeric(ctx.segment()),
                    "{epoch}"
            ),
            new PathRule(
                    "committee index",
                    ctx -> "committees".equals(ctx.previous()) && PathRule.isNumeric(ctx.segment()),
                    "{committee_index}"
            ),
            PathRule.after(Set.of("peers"), "{peer_id}"),
            new PathRule(
                    "block root",
                    ctx -> "bootstrap".equals(ctx.previous()) && PathRule.isHexRoot(ctx.segment()),
                    "{block_root}"
            ),
            new PathRule("numeric id", ctx -> PathRule.isNumeric(ctx.segment()), "{id}"),
            new PathRule("hex root", ctx -> PathRule.isHexRoot(ctx.segment()), "{root}")
    );

    private final List<PathRule> rules;

    public PathTemplateClassifier() {
        this(DEFAULT_RULES);
    }

    public PathTemplateClassifier(List<PathRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Classifies a path or full URL.
     *
     * @param path request path, optionally with query string
     * @return the path template, or empty if the path cannot be classified
     */
    public Optional<String> classify(String path) {
        try {
            return Optional.ofNullable(template(path));
        } catch (RuntimeException e) {
            log.debug("Path classification failed: error={}", e.toString());
            return Optional.empty();
        }
    }

    private String template(String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        String rawPath = path.trim();
        if (!rawPath.startsWith("/")) {
            rawPath = URI.create(rawPath).getRawPath();
            if (rawPath == null || !rawPath.startsWith("/")) {
                return null;
            }
        }
        rawPath = stripQuery(rawPath);

        String[] segments = rawPath.split("/", -1);
        List<String> templated = new ArrayList<>(segments.length);
        for (int i = 0; i < segments.length; i++) {
            String segment = segments[i];
            if (segment.isEmpty()) {
                templated.add(segment);
                continue;
            }
            SegmentContext context = new SegmentContext(
                    segment,
                    i >= 1 ? segments[i - 1] : "",
                    i >= 2 ? segments[i - 2] : ""
            );
            templated.add(applyRules(context));
        }
        return String.join("/", templated);
    }

    private String applyRules(SegmentContext context) {
        for (PathRule rule : rules) {
            if (rule.matches(context)) {
                return rule.apply(context);
            }
        }
        return context.segment();
    }

    private static String stripQuery(String path) {
        int end = path.length();
        int query = path.indexOf('?');
        if (query >= 0) {
            end = query;
        }
        int fragment = path.indexOf('#');
        if (fragment >= 0 && fragment < end) {
            end = fragment;
        }
        return path.substring(0, end);
    }

    public List<PathRule> getRules() {
        return rules;
    }
}
