package ca.gc.cra.logpipe.application.port;

import ca.gc.cra.logpipe.domain.log.CallerFrame;
import java.util.Optional;

/**
 * <strong>What:</strong> Platform boundary that resolves which source location issued a log call.
 * <p><strong>Why:</strong> Stack inspection is best effort and depends on how many wrapper frames sit between
 * the caller and the sink; keeping it behind a port lets deployments swap strategies.</p>
 * <p><strong>Role:</strong> Port consumed by sink bridges; implemented in {@code infrastructure.bridge}.</p>
 *
 * @since 0.1.0
 */
public interface CallerLocator {
  /**
   * Resolves the caller of the component that invoked this locator.
   *
   * <p>Implementations are called directly from the bridge's delivery method; the frames of the locator
   * and of that method are theirs to skip.</p>
   *
   * @return caller location, or empty when it cannot be determined
   */
  Optional<CallerFrame> locate();

  /**
   * Locator that never attributes a caller; the sink falls back to its own detection.
   */
  CallerLocator NONE = Optional::empty;
}
