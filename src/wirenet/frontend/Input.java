package wirenet.frontend;

import wirenet.WireNetException;
import wirenet.netlist.Block;

/** A WireVector receiving an external input of its block. Inputs can never be driven by a net. */
public class Input extends WireVector {
  public Input() { this(null, null, null); }
  public Input(Integer bitwidth) { this(bitwidth, null, null); }
  public Input(Integer bitwidth, String name) { this(bitwidth, name, null); }
  public Input(Integer bitwidth, String name, Block block) { super(bitwidth, name, block); }

  @Override
  protected char getKindCode() {
    return 'I';
  }

  @Override
  public WireVector assign(Object other) {
    throw notDrivable("assign");
  }

  @Override
  public WireVector conditionalAssign(Object other) {
    throw notDrivable("conditionalAssign");
  }

  @Override
  public void buildDriver(WireVector rhs) {
    throw notDrivable("a deferred assignment");
  }

  private WireNetException notDrivable(String how) {
    return new WireNetException(String.format("Connection using %s attempted on Input. Inputs, such as \"%s\", cannot have values "
                                                  + "generated internally, i.e. they can't have other wires driving them",
                                              how, getName()));
  }
}
