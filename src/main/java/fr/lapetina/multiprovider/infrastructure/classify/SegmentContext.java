package fr.lapetina.multiprovider.infrastructure.classify;

/**
 * A path segment together with the literal segments preceding it.
 *
 * @param segment        the segment being classified
 * @param previous       the segment right before it, empty at the start of the path
 * @param beforePrevious the segment before {@code previous}, empty when absent
 */
public record SegmentContext(String segment, String previous, String beforePrevious) {

    public SegmentContext {
        previous = previous != null ? previous : "";
        beforePrevious = beforePrevious != null ? beforePrevious : "";
    }
}
