package com.probnet.xdsl.validate;

import lombok.Getter;

/**
 * Thrown when a document fails validation. Carries every issue found, so
 * callers can show the complete list at once.
 */
@Getter
public class XdslValidationException extends RuntimeException {
    private final ValidationReport report;

    public XdslValidationException(ValidationReport report) {
        super("XDSL validation failed with " + report.size() + " issue(s):\n" + report.summary());
        this.report = report;
    }
}
