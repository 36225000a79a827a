package ca.gc.cra.logpipe.domain.log;

import java.util.Objects;

/**
 * Source location attributed to a log call.
 *
 * @param className fully qualified declaring class; never {@code null}
 * @param methodName method name; never {@code null}
 * @param fileName source file name; may be {@code null} when compiled without debug info
 * @param lineNumber source line, or a negative value when unknown
 * @since 0.1.0
 */
public record CallerFrame(String className, String methodName, String fileName, int lineNumber) {

  public CallerFrame {
    className = Objects.requireNonNull(className, "className");
    methodName = Objects.requireNonNull(methodName, "methodName");
  }

  /**
   * Converts this frame to the JDK representation expected by logging backends.
   *
   * @return equivalent stack trace element
   */
  public StackTraceElement toStackTraceElement() {
    return new StackTraceElement(className, methodName, fileName, lineNumber);
  }
}
