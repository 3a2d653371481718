package com.ringlist.util;

import com.ringlist.api.RingFormat;

final class RingFormatFixtures {
    private RingFormatFixtures() {
    }

    static final RingFormat BRACKETS = new RingFormat(", ", "<end>", "");
}
