package symgen.frontend;

import java.util.List;

/**
 * Enumerates the Cartesian product of a list of sets.
 */
public interface ProductEnumerator {
  /**
   * Returns the subscript tuples of the product, rightmost set varying fastest. Each iteration restarts the sequence.
   * An empty set list yields exactly one empty tuple.
   */
  Iterable<List<String>> product(List<String> sets, boolean alphabetic);
}
