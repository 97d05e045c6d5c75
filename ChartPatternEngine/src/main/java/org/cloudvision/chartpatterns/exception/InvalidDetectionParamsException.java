package org.cloudvision.chartpatterns.exception;

/**
 * Thrown when detection parameters are rejected before any scan runs.
 */
public class InvalidDetectionParamsException extends IllegalArgumentException {

    private final String parameter;

    public InvalidDetectionParamsException(String parameter, String message) {
        super("Invalid detection parameter '" + parameter + "': " + message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
