package ca.gc.cra.logpipe.domain.log;

import java.util.Objects;

/**
 * One forwarding step recorded in an {@link EventTrace}.
 *
 * <p>Hops compare their endpoints by identity, so two distinct observers that happen to be equal
 * never collapse into the same hop.</p>
 *
 * @param source component that forwarded the event; never {@code null}
 * @param destination component that received the event; never {@code null}
 * @since 0.1.0
 */
public record TraceHop(Object source, Object destination) {

  public TraceHop {
    source = Objects.requireNonNull(source, "source");
    destination = Objects.requireNonNull(destination, "destination");
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof TraceHop hop)) {
      return false;
    }
    return source == hop.source && destination == hop.destination;
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(source) + System.identityHashCode(destination);
  }
}
