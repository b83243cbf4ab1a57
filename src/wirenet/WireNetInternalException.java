package wirenet;

/**
 * Raised for states that can only be reached through a defect in WireNet itself, never through misuse of its API.
 */
public class WireNetInternalException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public WireNetInternalException(String message) { super(message); }
}
