package io.b2mash.b2b.taskengine.security;

public class ViewerNotBoundException extends RuntimeException {

  public ViewerNotBoundException() {
    super("Viewer context not available: viewer not bound by filter chain");
  }
}
