package io.b2mash.ismsp.compliance;

public record CategoryRollup(String category, long total, long covered, double rate) {}
