package wirenet.netlist;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import wirenet.WireNetInternalException;
import wirenet.frontend.WireVector;

/**
 * One operation of the netlist: an operation code, an optional parameter, the ordered argument wires and the driven wire.
 */
public final class LogicNet {
  private final OpCode op;
  private final List<Integer> param;
  private final List<WireVector> args;
  private final WireVector dest;

  /**
   * @param op the operation
   * @param param the selected bit positions for {@link OpCode#SELECT}, null for all other operations
   * @param args the argument wires, in the operation's order
   * @param dest the wire driven by this net
   */
  public LogicNet(OpCode op, List<Integer> param, List<WireVector> args, WireVector dest) {
    this.op = Objects.requireNonNull(op);
    this.dest = Objects.requireNonNull(dest);
    this.args = List.copyOf(args);
    if ((op == OpCode.SELECT) != (param != null))
      throw new WireNetInternalException(String.format("Net %c must %shave a parameter", op.symbol, param == null ? "" : "not "));
    this.param = (param == null) ? null : List.copyOf(param);
    if (op.getArity().map(arity -> arity != this.args.size()).orElse(this.args.isEmpty()))
      throw new WireNetInternalException(String.format("Net %c has an unexpected argument count of %d", op.symbol, this.args.size()));
  }

  public OpCode getOp() { return op; }
  public Optional<List<Integer>> getParam() { return Optional.ofNullable(param); }
  public List<WireVector> getArgs() { return args; }
  public WireVector getDest() { return dest; }

  @Override
  public int hashCode() {
    return Objects.hash(op, param, args, dest);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    LogicNet other = (LogicNet)obj;
    return op == other.op && Objects.equals(param, other.param) && args.equals(other.args) && dest.equals(other.dest);
  }

  /** Renders the net as "dest &lt;-- op -- arg, arg (param)". */
  @Override
  public String toString() {
    String argText = args.stream().map(WireVector::toString).collect(Collectors.joining(", "));
    String paramText = (param == null) ? "" : " " + param.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    return String.format("%s <-- %c -- %s%s", dest, op.symbol, argText, paramText);
  }
}
