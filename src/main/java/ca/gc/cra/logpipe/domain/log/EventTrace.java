package ca.gc.cra.logpipe.domain.log;

import java.util.ArrayList;
import java.util.List;

/**
 * Opt-in record of the path an event took through the pipeline.
 *
 * <p>Hops only ever accumulate; nothing in the pipeline removes or reorders them.
 * <strong>Thread-safety:</strong> not synchronized; an event is dispatched on a single thread.</p>
 *
 * @since 0.1.0
 */
public final class EventTrace {
  private final List<TraceHop> hops = new ArrayList<>();

  /**
   * Appends a hop from {@code source} to {@code destination}.
   *
   * @param source forwarding component
   * @param destination receiving component
   */
  public void record(Object source, Object destination) {
    hops.add(new TraceHop(source, destination));
  }

  /**
   * Returns the hops recorded so far in traversal order.
   *
   * @return immutable snapshot of the hops
   */
  public List<TraceHop> hops() {
    return List.copyOf(hops);
  }

  public int size() {
    return hops.size();
  }

  @Override
  public String toString() {
    return "EventTrace" + hops;
  }
}
