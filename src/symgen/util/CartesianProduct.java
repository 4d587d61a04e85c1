package symgen.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy Cartesian product over ordered dimensions, the rightmost dimension varying fastest.
 * A product of zero dimensions has exactly one (empty) tuple; any empty dimension makes the product empty.
 */
public class CartesianProduct implements Iterable<List<String>> {
  private final List<List<String>> dimensions;

  public CartesianProduct(List<List<String>> dimensions) {
    this.dimensions = new ArrayList<>();
    dimensions.forEach(dim -> this.dimensions.add(List.copyOf(dim)));
  }

  /** Number of tuples the product yields. */
  public long size() {
    long ret = 1;
    for (List<String> dim : dimensions)
      ret *= dim.size();
    return ret;
  }

  @Override
  public Iterator<List<String>> iterator() {
    return new Iterator<List<String>>() {
      private final int[] position = new int[dimensions.size()];
      private boolean done = dimensions.stream().anyMatch(List::isEmpty);

      @Override
      public boolean hasNext() {
        return !done;
      }

      @Override
      public List<String> next() {
        if (done)
          throw new NoSuchElementException();
        List<String> tuple = new ArrayList<>(position.length);
        for (int i = 0; i < position.length; ++i)
          tuple.add(dimensions.get(i).get(position[i]));
        advance();
        return Collections.unmodifiableList(tuple);
      }

      private void advance() {
        for (int i = position.length - 1; i >= 0; --i) {
          if (++position[i] < dimensions.get(i).size())
            return;
          position[i] = 0;
        }
        done = true;
      }
    };
  }
}
