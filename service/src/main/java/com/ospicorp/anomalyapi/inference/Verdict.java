package com.ospicorp.anomalyapi.inference;

// deviation is in units of the model's standard deviation, signed
public record Verdict(boolean anomaly, double deviation) {}
