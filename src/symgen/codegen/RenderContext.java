package symgen.codegen;

import java.util.Optional;
import symgen.frontend.Node;

/**
 * Top-down rendering state of one node. Derived copies are returned; an instance never changes.
 *
 * @param lhs node is on the left side of its equation
 * @param dt accumulated time shift
 * @param timeSubstitution a time subscript replaced by the element the shift leads to
 */
public record RenderContext(boolean lhs, int dt, Optional<TimeSubstitution> timeSubstitution) {

  /** Time subscript at {@code position} is rendered as {@code element}. */
  public record TimeSubstitution(int position, String element) {}

  public static RenderContext of(Node node) { return new RenderContext(node.lhs, node.dt, Optional.empty()); }

  public RenderContext withTimeSubstitution(int position, String element) {
    return new RenderContext(lhs, dt, Optional.of(new TimeSubstitution(position, element)));
  }
}
