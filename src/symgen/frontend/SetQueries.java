package symgen.frontend;

import java.util.ArrayList;
import java.util.List;

/**
 * Set membership and hierarchy queries.
 */
public interface SetQueries {
  /** Elements of a set in declaration order. Unknown sets yield an empty list. */
  List<String> elementsOf(String set);

  boolean isSubset(String subset, String superset);

  /** Sets directly containing the given one, in declaration order. */
  List<String> immediateSupersets(String set);

  boolean isSet(String name);

  /** True if the token is an element of some declared set. */
  boolean isElement(String token);

  /** True for the set named {@code time} and every subset of it. */
  default boolean isTimeSet(String set) { return set.equals("time") || isSubset(set, "time"); }

  default int cardinality(String set) { return elementsOf(set).size(); }

  /** Elements of a set in enumeration order, alphabetically sorted if requested. */
  default List<String> elementsOf(String set, boolean alphabetic) {
    List<String> ret = new ArrayList<>(elementsOf(set));
    if (alphabetic)
      ret.sort(null);
    return ret;
  }

  /** Position of an element within the enumeration order of a set, -1 if absent. */
  default int indexOf(String set, String element, boolean alphabetic) { return elementsOf(set, alphabetic).indexOf(element); }
}
