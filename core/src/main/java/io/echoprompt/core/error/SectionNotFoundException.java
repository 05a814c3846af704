package io.echoprompt.core.error;

/** Thrown in strict mode when {@code [#INCLUDE name]} names a section that was never declared. */
public final class SectionNotFoundException extends EchoEvalException {

    private static final long serialVersionUID = 1L;

    public SectionNotFoundException(String sectionName) {
        super("Section not found: " + sectionName, sectionName);
    }
}
