package dev.candor.explain;

public enum ConfidenceFlag {
  HIGH,
  LOW
}
