package com.mlhub.server.ai.tensor;

public enum TensorLayout {
    /** batch, height, width, channel */
    CHANNELS_LAST,
    /** batch, channel, height, width */
    CHANNELS_FIRST
}
