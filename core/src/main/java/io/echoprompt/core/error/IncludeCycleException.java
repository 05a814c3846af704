package io.echoprompt.core.error;

/** Thrown in strict mode when a section includes itself, directly or through other sections. */
public final class IncludeCycleException extends EchoEvalException {

    private static final long serialVersionUID = 1L;

    public IncludeCycleException(String sectionName, String chain) {
        super("Include cycle detected for section '" + sectionName + "': " + chain, sectionName);
    }
}
