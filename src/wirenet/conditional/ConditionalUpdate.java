package wirenet.conditional;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wirenet.WireNetException;
import wirenet.frontend.Const;
import wirenet.frontend.GuardContext;
import wirenet.frontend.Register;
import wirenet.frontend.WireVector;
import wirenet.netlist.Block;
import wirenet.netlist.WorkingBlock;
import wirenet.util.Wires;

/**
 * Guarded assignments for a block, resolved into multiplexers.
 * <pre>
 * ConditionalUpdate cu = ConditionalUpdate.of(block);
 * try (var ca = cu.conditionalAssignment()) {
 *   try (var w = cu.when(a)) {
 *     out.conditionalAssign(1);
 *   }
 *   try (var w = cu.when(b)) {
 *     out.conditionalAssign(2);
 *   }
 *   try (var w = cu.otherwise()) {
 *     out.conditionalAssign(3);
 *   }
 * }
 * </pre>
 * Sibling scopes on the same nesting level form an if/else-if chain. Nested scopes apply only if all enclosing scopes apply.
 * Closing the conditionalAssignment scope resolves all recorded assignments: each destination is driven by a chain of
 * multiplexers over its default value, which is the current value for registers and zero for all other wires. For
 * overlapping conditions, the assignment recorded last takes precedence.
 */
public class ConditionalUpdate implements GuardContext {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Block block;
  /** One entry per nesting level of the open conditionalAssignment, innermost first. */
  private final Deque<Level> levels = new ArrayDeque<>();
  /** Open when/otherwise scopes, innermost first. */
  private final Deque<ConditionScope> scopes = new ArrayDeque<>();
  private final LinkedHashMap<WireVector, List<Deferred>> deferred = new LinkedHashMap<>();
  private AssignmentScope assignmentScope = null;

  private static final class Level {
    final List<WireVector> priorConditions = new ArrayList<>();
    boolean otherwiseSeen = false;
  }

  private static record Deferred(WireVector predicate, WireVector rhs) {}

  /** The scope of a when or otherwise branch. */
  public final class ConditionScope implements GuardScope {
    private final WireVector predicate;
    private boolean closed = false;

    private ConditionScope(WireVector predicate) { this.predicate = predicate; }

    /** The 1-bit wire that is set iff this branch and all enclosing branches apply. */
    public WireVector getPredicate() { return predicate; }

    @Override
    public void close() {
      if (closed)
        return;
      if (scopes.peek() != this)
        throw new WireNetException("error, conditional scopes must be closed in reverse order of opening");
      scopes.pop();
      levels.pop();
      closed = true;
    }
  }

  /** The scope of a conditionalAssignment; closing it resolves the recorded assignments. */
  public final class AssignmentScope implements GuardScope {
    private boolean closed = false;

    private AssignmentScope() {}

    @Override
    public void close() {
      if (closed)
        return;
      if (!scopes.isEmpty())
        throw new WireNetException("error, conditionalAssignment closed while a when/otherwise scope is still open");
      levels.pop();
      assignmentScope = null;
      closed = true;
      finish();
    }
  }

  public ConditionalUpdate(Block block) { this.block = block; }

  /**
   * Returns the conditional update context of a block.
   * @param block the block, or null for the working block
   * @return the context
   */
  public static ConditionalUpdate of(Block block) {
    GuardContext guards = WorkingBlock.get(block).getGuardContext();
    if (!(guards instanceof ConditionalUpdate))
      throw new WireNetException(String.format("the block uses a custom guard context of type %s", guards.getClass().getName()));
    return (ConditionalUpdate)guards;
  }

  public Block getBlock() { return block; }

  /**
   * Opens the region in which when/otherwise scopes may be used.
   * @return the scope to close once all branches are done
   */
  public AssignmentScope conditionalAssignment() {
    if (assignmentScope != null)
      throw new WireNetException("error, conditionalAssignment cannot be nested");
    levels.push(new Level());
    assignmentScope = new AssignmentScope();
    logger.debug("Opened conditional assignment");
    return assignmentScope;
  }

  /**
   * Opens a branch that applies if condition is set and no earlier sibling branch applies.
   * @param condition a 1-bit wire of this block
   * @return the branch scope
   */
  public ConditionScope when(WireVector condition) {
    Level level = requireLevel("when");
    if (condition.getBlock() != block)
      throw new WireNetException(String.format("error, condition \"%s\" belongs to a different block", condition.getName()));
    if (condition.bitwidth() != 1)
      throw new WireNetException(
          String.format("error, condition \"%s\" must be a 1-bit WireVector, has %d bits", condition.getName(), condition.bitwidth()));
    if (level.otherwiseSeen)
      throw new WireNetException("error, when cannot follow otherwise on the same level");
    WireVector localPredicate = condition;
    if (!level.priorConditions.isEmpty())
      localPredicate = condition.and(noneOf(level.priorConditions));
    level.priorConditions.add(condition);
    return open(localPredicate, condition.getName());
  }

  /**
   * Opens a branch that applies if no earlier sibling branch applies.
   * @return the branch scope
   */
  public ConditionScope otherwise() {
    Level level = requireLevel("otherwise");
    if (level.priorConditions.isEmpty())
      throw new WireNetException("error, otherwise must follow a when on the same level");
    if (level.otherwiseSeen)
      throw new WireNetException("error, only one otherwise is allowed per level");
    level.otherwiseSeen = true;
    return open(noneOf(level.priorConditions), "otherwise");
  }

  private Level requireLevel(String what) {
    if (assignmentScope == null)
      throw new WireNetException(String.format("error, %s is only allowed within a conditionalAssignment", what));
    return levels.peek();
  }

  private WireVector noneOf(List<WireVector> conditions) {
    WireVector any = conditions.get(0);
    for (int i = 1; i < conditions.size(); ++i)
      any = any.or(conditions.get(i));
    return any.invert();
  }

  private ConditionScope open(WireVector localPredicate, String description) {
    WireVector predicate = scopes.isEmpty() ? localPredicate : scopes.peek().getPredicate().and(localPredicate);
    ConditionScope scope = new ConditionScope(predicate);
    scopes.push(scope);
    levels.push(new Level());
    logger.debug("Opened condition {} at depth {}, predicate {}", description, scopes.size(), predicate.getName());
    return scope;
  }

  @Override
  public boolean isGuardActive() {
    return !scopes.isEmpty();
  }

  @Override
  public void deferBuild(WireVector dest, WireVector rhs) {
    if (scopes.isEmpty())
      throw new WireNetException(String.format("error, conditional assignment to \"%s\" outside of a when/otherwise scope", dest.getName()));
    WireVector predicate = scopes.peek().getPredicate();
    deferred.computeIfAbsent(dest, k -> new ArrayList<>()).add(new Deferred(predicate, rhs));
    logger.debug("Deferred assignment {} <-- {} under {}", dest.getName(), rhs.getName(), predicate.getName());
  }

  @Override
  public GuardScope pushGuard(WireVector condition) {
    return when(condition);
  }

  /** True iff assignments are recorded that have not been resolved yet. */
  public boolean hasPendingAssignments() { return !deferred.isEmpty(); }

  /**
   * Resolves all recorded assignments into multiplexer chains and builds their drivers.
   * Called when the conditionalAssignment scope is closed.
   */
  public void finish() {
    if (assignmentScope != null)
      throw new WireNetException("error, cannot finish while a conditionalAssignment is still open");
    // taken out before building, so a failing driver never replays resolved assignments
    List<Map.Entry<WireVector, List<Deferred>>> pending = new ArrayList<>(deferred.entrySet());
    deferred.clear();
    for (Map.Entry<WireVector, List<Deferred>> entry : pending) {
      WireVector dest = entry.getKey();
      WireVector result = (dest instanceof Register) ? dest : new Const(0, dest.bitwidth(), null, false, block);
      for (Deferred assignment : entry.getValue())
        result = Wires.select(assignment.predicate(), assignment.rhs(), result);
      dest.buildDriver(result);
      logger.debug("Resolved {} conditional assignment(s) to {}", entry.getValue().size(), dest);
    }
  }
}
