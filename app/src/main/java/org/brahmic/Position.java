package org.brahmic;

// 1-based line and column in the source text
public record Position(int line, int column) {}
