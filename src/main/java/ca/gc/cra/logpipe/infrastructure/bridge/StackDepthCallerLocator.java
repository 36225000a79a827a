package ca.gc.cra.logpipe.infrastructure.bridge;

import ca.gc.cra.logpipe.application.port.CallerLocator;
import ca.gc.cra.logpipe.domain.log.CallerFrame;
import java.util.Optional;

/**
 * Attributes log calls by walking a fixed number of frames up from the bridge.
 *
 * <p>Depth {@code 1} is the frame that called the bridge's {@code deliver} directly. Each publisher or
 * filtering observer between the original call site and the bridge adds one frame, so a bridge behind
 * {@code LogPublisher -> FilteringObserver} needs depth {@code 3}. The locator's own frame and the bridge's
 * delivery frame are skipped automatically.</p>
 *
 * @implNote Frame counting is sensitive to how observers are composed; prefer
 * {@link BoundaryCallerLocator} when the wrapping depth varies.
 * @since 0.1.0
 */
public final class StackDepthCallerLocator implements CallerLocator {
  /** Depth of a direct call into the bridge. */
  public static final int DEFAULT_STACK_DEPTH = 1;

  // locate() plus the bridge's deliver()
  private static final int OWN_FRAMES = 2;

  private final StackWalker walker = StackWalker.getInstance();
  private final int depth;

  /**
   * Creates a locator for the given depth.
   *
   * @param depth number of frames above the bridge's delivery method; must be at least 1
   * @throws IllegalArgumentException if {@code depth} is below 1
   */
  public StackDepthCallerLocator(int depth) {
    if (depth < 1) {
      throw new IllegalArgumentException("stackDepth must be >= 1");
    }
    this.depth = depth;
  }

  public int depth() {
    return depth;
  }

  @Override
  public Optional<CallerFrame> locate() {
    long skip = OWN_FRAMES + depth - 1L;
    return walker.walk(frames -> frames.skip(skip).findFirst())
        .map(frame -> new CallerFrame(
            frame.getClassName(),
            frame.getMethodName(),
            frame.getFileName(),
            frame.getLineNumber()));
  }

  @Override
  public String toString() {
    return "StackDepthCallerLocator[depth=" + depth + "]";
  }
}
