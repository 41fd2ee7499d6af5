package fr.lapetina.multiprovider.domain.model;

/**
 * Outcome of one call against one endpoint, as exposed in the {@code result} metric tag.
 */
public enum CallStatus {
    SUCCESS("success"),
    FAIL("fail");

    private final String label;

    CallStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
