package com.pibridge.query;

import com.pibridge.domain.LegDiagnostics;
import com.pibridge.domain.Sample;
import com.pibridge.domain.StreamLeg;

import java.util.List;

/**
 * Normalized samples of one leg together with what was requested.
 */
public class LegResult {

    private final StreamLeg leg;
    private final List<Sample> samples;
    private final LegDiagnostics diagnostics;

    public LegResult(StreamLeg leg, List<Sample> samples, LegDiagnostics diagnostics) {
        this.leg = leg;
        this.samples = List.copyOf(samples);
        this.diagnostics = diagnostics;
    }

    public StreamLeg getLeg() {
        return leg;
    }

    public List<Sample> getSamples() {
        return samples;
    }

    public LegDiagnostics getDiagnostics() {
        return diagnostics;
    }
}
