package com.charter.core.validation;

import com.charter.core.model.RfcPhase;
import com.charter.core.model.RfcStatus;

import java.util.EnumMap;
import java.util.Map;

/**
 * Which (status, phase) combinations an RFC may be in.
 * <pre>
 *              spec   impl       test       stable
 * draft        ok     forbidden  forbidden  forbidden
 * normative    ok     ok         ok         ok
 * deprecated   warn   forbidden  forbidden  ok
 * </pre>
 */
public final class StatusPhaseMatrix {

    public enum Compatibility {
        ALLOWED,
        WARN,
        FORBIDDEN
    }

    private static final Map<RfcStatus, Map<RfcPhase, Compatibility>> CELLS = new EnumMap<>(RfcStatus.class);

    static {
        row(RfcStatus.DRAFT, Compatibility.ALLOWED, Compatibility.FORBIDDEN, Compatibility.FORBIDDEN, Compatibility.FORBIDDEN);
        row(RfcStatus.NORMATIVE, Compatibility.ALLOWED, Compatibility.ALLOWED, Compatibility.ALLOWED, Compatibility.ALLOWED);
        row(RfcStatus.DEPRECATED, Compatibility.WARN, Compatibility.FORBIDDEN, Compatibility.FORBIDDEN, Compatibility.ALLOWED);
    }

    private StatusPhaseMatrix() {}

    public static Compatibility compatibility(RfcStatus status, RfcPhase phase) {
        return CELLS.get(status).get(phase);
    }

    private static void row(RfcStatus status, Compatibility spec, Compatibility impl,
                            Compatibility test, Compatibility stable) {
        Map<RfcPhase, Compatibility> cells = new EnumMap<>(RfcPhase.class);
        cells.put(RfcPhase.SPEC, spec);
        cells.put(RfcPhase.IMPL, impl);
        cells.put(RfcPhase.TEST, test);
        cells.put(RfcPhase.STABLE, stable);
        CELLS.put(status, cells);
    }
}
