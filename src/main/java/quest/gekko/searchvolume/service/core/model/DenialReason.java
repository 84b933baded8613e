package quest.gekko.searchvolume.service.core.model;

public enum DenialReason {
    NO_SUBSCRIPTION("no subscription"),
    INSUFFICIENT_RANGE("insufficient subscription range"),
    INSUFFICIENT_CAPABILITY("insufficient capability");

    private final String label;

    DenialReason(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
