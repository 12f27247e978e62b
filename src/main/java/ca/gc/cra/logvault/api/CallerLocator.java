package ca.gc.cra.logvault.api;

import java.util.Optional;
import java.util.Set;

/**
 * Finds the first stack frame outside the logging facade and renders it as {@code Class.method:line}.
 */
final class CallerLocator {
  private static final Set<String> FACADE_CLASSES = Set.of(
      StructuredLogger.class.getName(),
      LogEngine.class.getName(),
      BoundLogger.class.getName(),
      CallerLocator.class.getName());
  private static final StackWalker WALKER = StackWalker.getInstance();

  private CallerLocator() {}

  static String locate() {
    Optional<StackWalker.StackFrame> caller = WALKER.walk(frames -> frames
        .filter(frame -> !isFacade(frame.getClassName()))
        .findFirst());
    return caller.map(CallerLocator::render).orElse(null);
  }

  private static boolean isFacade(String className) {
    int nested = className.indexOf('$');
    return FACADE_CLASSES.contains(nested < 0 ? className : className.substring(0, nested));
  }

  private static String render(StackWalker.StackFrame frame) {
    String className = frame.getClassName();
    String simple = className.substring(className.lastIndexOf('.') + 1);
    return simple + "." + frame.getMethodName() + ":" + frame.getLineNumber();
  }
}
