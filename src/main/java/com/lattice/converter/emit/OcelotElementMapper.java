package com.lattice.converter.emit;

import java.util.Optional;

import com.lattice.converter.model.ElementDefinition;
import com.lattice.converter.model.ParseDiagnostics;

/**
 * Maps one SAD element onto the matching OCELOT constructor call.
 *
 * Unset parameters read as 0.0. Kinds without an OCELOT counterpart map to
 * {@link Optional#empty()}.
 */
public class OcelotElementMapper {

    public Optional<String> map(ElementDefinition e, ParseDiagnostics diagnostics) {
        String name = e.getName();
        double length = e.parameter("L");

        e.getParameters().forEach((parameter, value) -> {
            if (!Double.isFinite(value)) {
                diagnostics.warn("Parameter " + parameter + " of element " + name + " is " + value
                        + " and is written as " + num(value));
            }
        });

        return switch (e.getKind()) {
            case DRIFT -> Optional.of(drift(name, length));
            case MONI -> Optional.of(assign(name, "Monitor", "l=" + num(length)));
            case MARK, MAP, APERT, COORD -> Optional.of(name + " = Marker(eid=\"" + name + "\")");
            case BEND -> Optional.of(bend(e));
            case QUAD -> Optional.of(quadrupole(e));
            case MULT -> {
                diagnostics.warn("MULT element " + name + " simplified to " + (length > 0 ? "Quadrupole" : "Drift"));
                yield Optional.of(length > 0 ? quadrupole(e) : drift(name, length));
            }
            case SEXT -> Optional.of(assign(name, "Sextupole",
                    "l=" + num(length) + ",k2=" + num(e.parameter("K2")) + ",tilt=" + num(e.parameter("ROTATE"))));
            case SOL -> Optional.of(assign(name, "Solenoid", "l=" + num(length)));
            case CAVI -> Optional.of(cavity(e));
            default -> Optional.empty();
        };
    }

    private String drift(String name, double length) {
        return assign(name, "Drift", "l=" + num(length));
    }

    private String bend(ElementDefinition e) {
        double angle = e.parameter("ANGLE");
        double e1 = e.parameter("E1") * angle;
        double e2 = e.parameter("E2") * angle;
        double tilt = -e.parameter("ROTATE");
        return assign(e.getName(), "SBend", "l=" + num(e.parameter("L")) + ",angle=" + num(angle)
                + ",e1=" + num(e1) + ",e2=" + num(e2) + ",tilt=" + num(tilt));
    }

    private String quadrupole(ElementDefinition e) {
        double length = e.parameter("L");
        double k1 = length != 0.0 ? e.parameter("K1") / length : 0.0;
        return assign(e.getName(), "Quadrupole",
                "l=" + num(length) + ",k1=" + num(k1) + ",tilt=" + num(e.parameter("ROTATE")));
    }

    private String cavity(ElementDefinition e) {
        double phi = 90 + e.parameter("PHI") * 180 / Math.PI;
        double volt = e.parameter("VOLT") * 1.e-9;
        return assign(e.getName(), "Cavity", "l=" + num(e.parameter("L")) + ",freq=" + num(e.parameter("FREQ"))
                + ", v=" + num(volt) + ", phi=" + num(phi));
    }

    private static String assign(String name, String constructor, String arguments) {
        return name + " = " + constructor + "(eid=\"" + name + "\"," + arguments + ")";
    }

    /**
     * Shortest round-trip form of the value as a Python float expression.
     * Infinities and NaN go through {@code float(...)} since Python has no literal for them.
     */
    static String num(double value) {
        if (Double.isNaN(value)) {
            return "float('nan')";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "float('inf')" : "float('-inf')";
        }
        return Double.toString(value);
    }
}
