package io.b2mash.ismsp.report;

public record CategoryCoverage(String category, long coveredCount) {}
