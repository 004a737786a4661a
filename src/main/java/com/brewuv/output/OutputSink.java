package com.brewuv.output;

import com.brewuv.model.Result;

import java.io.IOException;

/**
 * Consumer of finished results (spectral text files, plots). Implementations must be thread-safe.
 */
public interface OutputSink {

    OutputArtifacts write(Result result) throws IOException;
}
