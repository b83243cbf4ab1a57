package wirenet;

/**
 * Raised when the circuit construction API is used in a way that cannot describe valid hardware,
 * e.g. a zero bitwidth, driving an Input or an empty bit selection.
 */
public class WireNetException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public WireNetException(String message) { super(message); }
}
