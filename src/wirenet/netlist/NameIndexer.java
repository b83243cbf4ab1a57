package wirenet.netlist;

import java.util.concurrent.atomic.AtomicInteger;

/** Generates prefix0, prefix1, ... */
public class NameIndexer {
  private final String prefix;
  private final AtomicInteger counter = new AtomicInteger();

  public NameIndexer(String prefix) { this.prefix = prefix; }

  public String makeValidString() { return prefix + counter.getAndIncrement(); }

  public String getPrefix() { return prefix; }
}
