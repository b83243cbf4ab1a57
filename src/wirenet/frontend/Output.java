package wirenet.frontend;

import wirenet.netlist.Block;

/**
 * A WireVector providing an output of its block. By convention, Outputs are not read inside the block; this is not checked.
 */
public class Output extends WireVector {
  public Output() { this(null, null, null); }
  public Output(Integer bitwidth) { this(bitwidth, null, null); }
  public Output(Integer bitwidth, String name) { this(bitwidth, name, null); }
  public Output(Integer bitwidth, String name, Block block) { super(bitwidth, name, block); }

  @Override
  protected char getKindCode() {
    return 'O';
  }
}
