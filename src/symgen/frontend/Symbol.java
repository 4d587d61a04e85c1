package symgen.frontend;

import java.util.List;

/**
 * Declared set, parameter or variable.
 *
 * @param name symbol name as written in the model
 * @param type symbol class
 * @param description free text, empty if none
 * @param domain declared domain (set names) of a parameter or variable; for a set, its elements
 * @param attributes attribute tags, in declaration order
 */
public record Symbol(String name, SymbolType type, String description, List<String> domain, List<String> attributes) {
  public Symbol {
    domain = List.copyOf(domain);
    attributes = List.copyOf(attributes);
    description = (description == null) ? "" : description;
  }

  public boolean isSet() { return type == SymbolType.Set; }
  public boolean isParameter() { return type == SymbolType.Parameter; }
  public boolean isVariable() { return type == SymbolType.Variable; }
  public boolean hasAttribute(String attribute) { return attributes.contains(attribute); }

  @Override
  public String toString() {
    return type.serialName + " " + name + (domain.isEmpty() ? "" : "(" + String.join(",", domain) + ")");
  }
}
