package com.brewuv.input;

import com.brewuv.config.Config;
import com.brewuv.data.CloudCoverClient;
import com.brewuv.data.EubrewnetClient;
import com.brewuv.parse.ArfFileParser;
import com.brewuv.parse.CalibrationFileParser;
import com.brewuv.parse.OzoneFileParser;
import com.brewuv.parse.ParameterFileParser;
import com.brewuv.parse.UvFileParser;

/**
 * Parsers, remote clients and defaults shared by all aggregates of a run.
 */
public final class InputProviders {
    public final Config config;
    public final UvFileParser uvParser = new UvFileParser();
    public final OzoneFileParser ozoneParser = new OzoneFileParser();
    public final CalibrationFileParser calibrationParser = new CalibrationFileParser();
    public final ArfFileParser arfParser;
    public final ParameterFileParser parameterParser = new ParameterFileParser();
    /** Null when the instrument network is disabled. */
    public final EubrewnetClient eubrewnet;
    public final CloudCoverClient cloudCover;

    public InputProviders(Config config, EubrewnetClient eubrewnet, CloudCoverClient cloudCover) {
        this.config = config;
        this.arfParser = new ArfFileParser(Math.max(1, config.getInt("arf.column", ArfFileParser.DEFAULT_COLUMN)));
        this.eubrewnet = eubrewnet;
        this.cloudCover = cloudCover;
    }

    public static InputProviders fromConfig(Config config) {
        EubrewnetClient eubrewnet = config.getBoolean("eubrewnet.enabled", false) ? new EubrewnetClient(config) : null;
        return new InputProviders(config, eubrewnet, new CloudCoverClient(config));
    }
}
