package com.brewuv.output;

import com.brewuv.model.Result;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Writes nothing to disk; logs a one-line summary per result. Used when no file writer is plugged in.
 */
public final class LogOutputSink implements OutputSink {
    private static final Logger log = LogManager.getLogger("RESULTS");

    @Override
    public OutputArtifacts write(Result result) {
        log.info("brewer={} date={} section={} sza={} airMass={} model={} ozone={}({}) cloud={}({}) points={}",
                result.brewerId,
                result.date,
                result.sectionIndex,
                String.format("%.3f", result.solarZenithAngle),
                String.format("%.4f", result.airMass),
                result.cosCorrection,
                result.parameters.ozone,
                result.parameters.ozoneSource,
                result.parameters.cloudCover,
                result.parameters.cloudSource,
                result.spectrum.size());
        return OutputArtifacts.none(OutputStage.resultId(result));
    }
}
