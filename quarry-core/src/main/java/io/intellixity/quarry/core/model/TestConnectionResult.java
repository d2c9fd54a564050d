package io.intellixity.quarry.core.model;

public record TestConnectionResult(boolean success, String message) {
  public static TestConnectionResult ok(String message) { return new TestConnectionResult(true, message); }
  public static TestConnectionResult failed(String message) { return new TestConnectionResult(false, message); }
}
