package com.conduit.monitor.model;

/**
 * Warning and critical levels per resource. CPU and memory are percentages, network and disk are
 * bytes per second, processes is a count. Only CPU and memory are checked against samples.
 */
public record ThresholdConfig(
        Level cpu,
        Level memory,
        Level network,
        Level disk,
        Level processes
) {

    private static final double MIB = 1024 * 1024;

    public static ThresholdConfig defaults() {
        return new ThresholdConfig(
                new Level(70, 90),
                new Level(80, 95),
                new Level(100 * MIB, 200 * MIB),
                new Level(50 * MIB, 100 * MIB),
                new Level(100, 200));
    }

    public record Level(double warning, double critical) {

        public Level {
            if (warning >= critical) {
                throw new IllegalArgumentException(
                        "Warning threshold must be below critical: warning=" + warning + ", critical=" + critical);
            }
        }
    }
}
