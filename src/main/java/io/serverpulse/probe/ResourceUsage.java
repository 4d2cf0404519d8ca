package io.serverpulse.probe;

public record ResourceUsage(double cpuPercent, double ramPercent, long ramKb) {
    public double ramMb() {
        return ramKb / 1024.0d;
    }
}
