package com.brewuv.calc;

import com.brewuv.model.CloudSource;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class CloudCoverResolution {
    public static final CloudCoverResolution NONE = new CloudCoverResolution(null, CloudSource.NONE);

    public final Double value;
    public final CloudSource source;
}
