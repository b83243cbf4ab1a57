package wirenet.util;

import java.util.ArrayList;
import java.util.List;
import wirenet.WireNetException;

/**
 * Resolves list-style slices (start, stop, step, each optional and possibly negative) to explicit positions.
 */
public final class Slices {
  private Slices() {}

  /**
   * Lists the positions of 0..length-1 selected by a slice.
   * @param length the number of positions
   * @param start the first position, or null
   * @param stop the end position (exclusive), or null
   * @param step the distance between positions, non-zero; null for 1
   * @return the selected positions in selection order, possibly empty
   */
  public static List<Integer> indices(int length, Integer start, Integer stop, Integer step) {
    int stepVal = (step == null) ? 1 : step;
    if (stepVal == 0)
      throw new WireNetException("slice step cannot be zero");
    // Clamp bounds: [0, length] for positive steps, [-1, length-1] for negative steps.
    int lower = (stepVal > 0) ? 0 : -1;
    int upper = (stepVal > 0) ? length : length - 1;
    int startVal = (start == null) ? (stepVal > 0 ? lower : upper) : clamp(start, length, lower, upper);
    int stopVal = (stop == null) ? (stepVal > 0 ? upper : lower) : clamp(stop, length, lower, upper);

    List<Integer> positions = new ArrayList<>();
    // long counter: start + step may exceed the int range
    for (long i = startVal; stepVal > 0 ? i < stopVal : i > stopVal; i += stepVal)
      positions.add((int)i);
    return positions;
  }

  private static int clamp(int index, int length, int lower, int upper) {
    if (index < 0)
      index += length;
    if (index < lower)
      return lower;
    if (index > upper)
      return upper;
    return index;
  }
}
