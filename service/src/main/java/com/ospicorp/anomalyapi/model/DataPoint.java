package com.ospicorp.anomalyapi.model;

// Single observation; timestamp is unix seconds
public record DataPoint(long timestamp, double value) {}
