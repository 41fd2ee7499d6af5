package fr.lapetina.multiprovider.infrastructure.classify;

import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * One entry of the ordered path classification catalog: when the predicate matches a
 * segment in its context, the segment is replaced by the template.
 *
 * @param name      rule name, used in logs and tests
 * @param predicate matching condition
 * @param template  replacement, or {@code null} to keep the segment as is
 */
public record PathRule(String name, Predicate<SegmentContext> predicate, String template) {

    private static final Pattern NUMERIC = Pattern.compile("^\\d+$");
    private static final Pattern HEX_ROOT = Pattern.compile("^0x[0-9a-fA-F]{64,}$");
    private static final Pattern PLACEHOLDER = Pattern.compile("^\\{[A-Za-z0-9_]+}$");

    public PathRule {
        Objects.requireNonNull(name, "Rule name is required");
        Objects.requireNonNull(predicate, "Rule predicate is required");
    }

    public boolean matches(SegmentContext context) {
        return predicate.test(context);
    }

    /**
     * Returns the replacement of a matched segment.
     */
    public String apply(SegmentContext context) {
        return template != null ? template : context.segment();
    }

    /**
     * Rule replacing a segment that follows the given literal.
     */
    public static PathRule after(Set<String> previous, String template) {
        return new PathRule("after " + previous, ctx -> previous.contains(ctx.previous()), template);
    }

    /**
     * Rule replacing a segment that follows the two given literals, in order.
     */
    public static PathRule afterPair(String beforePrevious, String previous, String template) {
        return new PathRule(
                "after " + beforePrevious + "/" + previous,
                ctx -> beforePrevious.equals(ctx.beforePrevious()) && previous.equals(ctx.previous()),
                template
        );
    }

    public static boolean isNumeric(String segment) {
        return NUMERIC.matcher(segment).matches();
    }

    /**
     * True for a 0x-prefixed hex value of at least 32 bytes.
     */
    public static boolean isHexRoot(String segment) {
        return HEX_ROOT.matcher(segment).matches();
    }

    public static boolean isPlaceholder(String segment) {
        return PLACEHOLDER.matcher(segment).matches();
    }
}
