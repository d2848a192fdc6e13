package com.lattice.converter.model;

import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One lattice element parsed from a {@code NAME = (...)} body.
 */
@Value
@Builder
public class ElementDefinition {

    /** Raw kind used for elements opened with no keyword in effect. */
    public static final String NO_KIND = "None";

    @NonNull
    ElementKind kind;

    /** Keyword as written in the source, kept for reporting. */
    @NonNull
    String rawKind;

    @NonNull
    String name;

    @Singular
    Map<String, Double> parameters;

    /**
     * Value of a parameter, or {@code 0.0} when the source never set it.
     */
    public double parameter(String parameterName) {
        Double value = parameters.get(parameterName);
        return value != null ? value : 0.0;
    }

    public boolean hasParameter(String parameterName) {
        return parameters.containsKey(parameterName);
    }

    public boolean isRecognized() {
        return kind != ElementKind.UNRECOGNIZED;
    }

    @Override
    public String toString() {
        return rawKind + " : " + name + "  :  " + parameters;
    }
}
