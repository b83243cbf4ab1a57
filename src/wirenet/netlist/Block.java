package wirenet.netlist;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wirenet.WireNetException;
import wirenet.WireNetInternalException;
import wirenet.conditional.ConditionalUpdate;
import wirenet.config.WireNetConfig;
import wirenet.frontend.Const;
import wirenet.frontend.GuardContext;
import wirenet.frontend.Input;
import wirenet.frontend.WireVector;

/**
 * Container of all wires and nets of one circuit.
 * Wires are indexed by name, nets are kept in the order they were added.
 * Not thread-safe.
 */
public class Block {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final WireNetConfig config;
  private final LinkedHashMap<String, WireVector> wirevectorByName = new LinkedHashMap<>();
  private final List<LogicNet> logic = new ArrayList<>();
  private final NameIndexer tempIndexer;
  private final NameIndexer constIndexer;
  private GuardContext guardContext;

  public Block() { this(new WireNetConfig()); }
  public Block(WireNetConfig config) {
    this.config = Objects.requireNonNull(config);
    this.tempIndexer = new NameIndexer(config.temp_prefix);
    this.constIndexer = new NameIndexer(config.const_prefix);
    this.guardContext = new ConditionalUpdate(this);
  }

  public WireNetConfig getConfig() { return config; }

  public GuardContext getGuardContext() { return guardContext; }
  /**
   * Replaces the guard context that conditional assignments into this block are deferred to.
   * @param guardContext the new guard context
   */
  public void setGuardContext(GuardContext guardContext) { this.guardContext = Objects.requireNonNull(guardContext); }

  /**
   * Registers a wire under its current name. Registering a wire again under the same name has no effect.
   * @param wire the wire, must belong to this block
   */
  public void add(WireVector wire) {
    if (wire.getBlock() != this)
      throw new WireNetException(String.format("WireVector \"%s\" belongs to a different block", wire.getName()));
    checkNameAvailable(wire.getName(), wire);
    if (wirevectorByName.put(wire.getName(), wire) == null)
      logger.debug("Registered wire {}", wire);
  }

  /**
   * Removes the index entry of a wire. Nets referring to the wire are kept.
   * @param wire the wire
   */
  public void remove(WireVector wire) {
    if (wirevectorByName.get(wire.getName()) == wire)
      wirevectorByName.remove(wire.getName());
  }

  /**
   * Throws if a name is held by a wire other than the given one.
   * @param name the name to check
   * @param wire the wire that wants to use the name, or null
   */
  public void checkNameAvailable(String name, WireVector wire) {
    WireVector existing = wirevectorByName.get(name);
    if (existing != null && existing != wire)
      throw new WireNetException(String.format("Duplicate wire name \"%s\": WireVector names must be unique within a block", name));
  }

  public Optional<WireVector> getWireVector(String name) { return Optional.ofNullable(wirevectorByName.get(name)); }

  /** Returns all registered wires in registration order. */
  public Collection<WireVector> wirevectors() { return Collections.unmodifiableCollection(wirevectorByName.values()); }

  /**
   * Returns the registered wires of a given kind, including subclasses.
   * @param cls the kind, e.g. Input.class
   * @return the matching wires in registration order
   */
  public <T extends WireVector> Set<T> wirevectorSubset(Class<T> cls) {
    return wirevectorByName.values().stream().filter(cls::isInstance).map(cls::cast).collect(Collectors.toCollection(LinkedHashSet::new));
  }

  /** Returns all nets in the order they were added. */
  public List<LogicNet> nets() { return Collections.unmodifiableList(logic); }

  /**
   * Returns the nets with one of the given operations.
   * @param ops the operations to keep; all nets are returned if empty
   * @return the matching nets in the order they were added
   */
  public List<LogicNet> logicSubset(OpCode... ops) {
    if (ops.length == 0)
      return nets();
    EnumSet<OpCode> opSet = EnumSet.noneOf(OpCode.class);
    Collections.addAll(opSet, ops);
    return logic.stream().filter(net -> opSet.contains(net.getOp())).collect(Collectors.toList());
  }

  /**
   * Appends a net. All wires of the net must belong to this block.
   * @param net the net to append
   */
  public void addNet(LogicNet net) {
    Stream.concat(net.getArgs().stream(), Stream.of(net.getDest())).forEach(wire -> {
      if (wire.getBlock() != this)
        throw new WireNetException(String.format("Net %s mixes WireVectors of different blocks (\"%s\")", net, wire.getName()));
    });
    WireVector dest = net.getDest();
    if (dest instanceof Input || dest instanceof Const)
      throw new WireNetInternalException(String.format("Net %s drives %s, which can never be driven", net, dest.getName()));
    logic.add(net);
    logger.debug("Added net {}", net);
  }

  /**
   * Generates an unused temporary wire name.
   * @param suffix text appended to the generated name, e.g. a source location, or ""
   * @return the name
   */
  public String makeTempName(String suffix) {
    String name;
    do {
      name = tempIndexer.makeValidString() + suffix;
    } while (wirevectorByName.containsKey(name));
    return name;
  }

  /**
   * Generates an unused constant wire name.
   * @param literal the literal the constant was created from
   * @return the name
   */
  public String makeConstName(Object literal) {
    String name;
    do {
      name = constIndexer.makeValidString() + "_" + literal;
    } while (wirevectorByName.containsKey(name));
    return name;
  }

  /** One net per line, in the order the nets were added. */
  @Override
  public String toString() {
    return logic.stream().map(LogicNet::toString).collect(Collectors.joining("\n"));
  }
}
