package io.serverpulse.probe;

import java.util.Optional;

public interface ResourceProbe {
    /**
     * CPU and memory usage of {@code pid}, or empty when the process is gone or the probe
     * could not be read.
     */
    Optional<ResourceUsage> sample(long pid);
}
