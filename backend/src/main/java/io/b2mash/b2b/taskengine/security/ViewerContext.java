package io.b2mash.b2b.taskengine.security;

import io.b2mash.b2b.taskengine.assignment.Viewer;

/**
 * Request-bound viewer identity. Bound by {@link ViewerFilter} from the verified JWT only, read by
 * controllers. Never populated from request bodies or parameters.
 */
public final class ViewerContext {

  private static final ThreadLocal<Viewer> CURRENT_VIEWER = new ThreadLocal<>();

  private ViewerContext() {}

  static void bind(Viewer viewer) {
    CURRENT_VIEWER.set(viewer);
  }

  static void clear() {
    CURRENT_VIEWER.remove();
  }

  /** Returns the current viewer. Throws if not bound by the filter chain. */
  public static Viewer requireViewer() {
    Viewer viewer = CURRENT_VIEWER.get();
    if (viewer == null) {
      throw new ViewerNotBoundException();
    }
    return viewer;
  }

  /** Returns the current viewer, or null if not bound. */
  public static Viewer getViewerOrNull() {
    return CURRENT_VIEWER.get();
  }
}
