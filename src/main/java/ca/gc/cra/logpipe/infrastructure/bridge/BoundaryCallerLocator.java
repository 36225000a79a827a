package ca.gc.cra.logpipe.infrastructure.bridge;

import ca.gc.cra.logpipe.application.filter.FilteringObserver;
import ca.gc.cra.logpipe.application.port.CallerLocator;
import ca.gc.cra.logpipe.application.publish.LogPublisher;
import ca.gc.cra.logpipe.domain.log.CallerFrame;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Attributes log calls to the first frame outside a set of pipeline classes.
 *
 * <p>Unlike {@link StackDepthCallerLocator} this does not depend on how many wrappers sit between the call
 * site and the bridge. A boundary entry ending in {@code '.'} matches a whole package; any other entry matches
 * the named class and its nested classes.</p>
 *
 * @since 0.1.0
 */
public final class BoundaryCallerLocator implements CallerLocator {
  private final StackWalker walker = StackWalker.getInstance();
  private final List<String> boundaries;

  /**
   * Creates a locator skipping the supplied classes and packages.
   *
   * @param boundaries class names or package prefixes (ending in {@code '.'}) to skip; must not be {@code null}
   */
  public BoundaryCallerLocator(List<String> boundaries) {
    this.boundaries = List.copyOf(Objects.requireNonNull(boundaries, "boundaries"));
  }

  /**
   * Creates a locator that skips the pipeline's own publishers, filters and bridge.
   *
   * @return locator for the standard pipeline classes
   */
  public static BoundaryCallerLocator forPipeline() {
    return new BoundaryCallerLocator(List.of(
        BoundaryCallerLocator.class.getName(),
        LogbackBridgeObserver.class.getName(),
        FilteringObserver.class.getName(),
        LogPublisher.class.getName()));
  }

  public List<String> boundaries() {
    return boundaries;
  }

  @Override
  public Optional<CallerFrame> locate() {
    return walker.walk(frames -> frames
            .filter(frame -> !isBoundary(frame.getClassName()))
            .findFirst())
        .map(frame -> new CallerFrame(
            frame.getClassName(),
            frame.getMethodName(),
            frame.getFileName(),
            frame.getLineNumber()));
  }

  boolean isBoundary(String className) {
    for (String boundary : boundaries) {
      if (boundary.endsWith(".")) {
        if (className.startsWith(boundary)) {
          return true;
        }
      } else if (className.equals(boundary) || className.startsWith(boundary + "$")) {
        return true;
      }
    }
    return false;
  }
}
