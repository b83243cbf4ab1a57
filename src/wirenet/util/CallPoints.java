package wirenet.util;

import java.lang.StackWalker.StackFrame;
import java.security.CodeSource;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Locates the user code that constructs a wire, for debug names and construction stacks.
 */
public final class CallPoints {
  private static final StackWalker walker = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

  private CallPoints() {}

  /**
   * Finds the innermost stack frame outside of the WireNet library (i.e. loaded from a different code source).
   * @return the frame, or empty if the whole stack is library code
   */
  public static Optional<StackFrame> findUserCallPoint() {
    CodeSource libSource = CallPoints.class.getProtectionDomain().getCodeSource();
    return walker.walk(frames -> frames.filter(frame -> !isLibraryFrame(frame, libSource)).findFirst());
  }

  private static boolean isLibraryFrame(StackFrame frame, CodeSource libSource) {
    Class<?> cls = frame.getDeclaringClass();
    if (cls.getName().startsWith("java.") || cls.getName().startsWith("jdk."))
      return true;
    if (!cls.getName().startsWith("wirenet."))
      return false;
    CodeSource source = cls.getProtectionDomain().getCodeSource();
    return libSource == null || source == null || Objects.equals(source.getLocation(), libSource.getLocation());
  }

  /**
   * Formats a frame as a name suffix "_File_lineN". Non-word characters of the file name are removed.
   * @param frame the frame
   * @return the suffix
   */
  public static String nameSuffix(StackFrame frame) {
    String fileName = Optional.ofNullable(frame.getFileName()).orElse(frame.getClassName());
    String safeName = fileName.replaceAll("\\W+", "");
    return String.format("_%s_line%d", safeName, frame.getLineNumber());
  }

  /**
   * Captures the current call stack.
   * @return one entry per frame, innermost first
   */
  public static List<String> captureStack() {
    return walker.walk(frames -> frames.map(StackFrame::toStackTraceElement).map(StackTraceElement::toString).collect(Collectors.toList()));
  }
}
