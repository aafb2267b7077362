package io.b2mash.ismsp.compliance;

public record ComplianceSummary(long total, long covered, double rate) {}
