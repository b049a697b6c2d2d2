package net.slotwatch.core.spi;

import java.time.Instant;

@FunctionalInterface
public interface Clock {
    Instant now();
}
