package symgen.frontend;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a model description from YAML.
 *
 * <pre>
 * sets:
 *   - {name: regions, elements: [US, EU], description: Regions}
 *   - {name: oecd, elements: [US], subsetOf: [regions]}
 * parameters:
 *   - {name: alpha, domain: [regions], attributes: [P001]}
 * variables:
 *   - {name: X, domain: [regions], attributes: [end, gdp], description: Output}
 * equations:
 *   - name: eq_x
 *     description: Output identity
 *     lhs: [nam, X, [regions]]
 *     rhs: [mul, [nam, alpha, [regions]], 2]
 * </pre>
 *
 * A number is a num node, a plain string a scalar name, and a list {@code [kind, args...]} a node of that kind.
 */
public class ModelReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public Model read(Path file) throws IOException {
    logger.debug("Reading model {}", file);
    try (InputStream in = Files.newInputStream(file)) {
      return read(new InputStreamReader(in, StandardCharsets.UTF_8), file.toString());
    }
  }

  public Model read(String yamlText) throws IOException { return read(new StringReader(yamlText), "<string>"); }

  private Model read(Reader reader, String origin) throws IOException {
    Object root;
    try {
      root = new Yaml().load(reader);
    } catch (YAMLException e) {
      throw new IOException("Malformed YAML in " + origin + ": " + e.getMessage(), e);
    }
    if (root == null)
      root = Map.of();
    if (!(root instanceof Map))
      throw new IOException("Model file " + origin + " must contain a mapping");
    Map<?, ?> data = (Map<?, ?>)root;
    Model.Builder builder = new Model.Builder();
    try {
      for (Map<?, ?> entry : entries(data, "sets")) {
        List<String> supersets = strings(entry.get("subsetOf"));
        String name = text(entry, "name");
        List<String> elements = strings(entry.get("elements"));
        if (supersets.isEmpty())
          builder.set(name, optionalText(entry, "description"), elements);
        else
          builder.subset(name, optionalText(entry, "description"), elements, supersets.toArray(new String[0]));
      }
      for (Map<?, ?> entry : entries(data, "parameters"))
        builder.parameter(text(entry, "name"), optionalText(entry, "description"), strings(entry.get("domain")),
                          strings(entry.get("attributes")));
      for (Map<?, ?> entry : entries(data, "variables"))
        builder.variable(text(entry, "name"), optionalText(entry, "description"), strings(entry.get("domain")),
                         strings(entry.get("attributes")));
      for (Map<?, ?> entry : entries(data, "equations")) {
        Object name = entry.get("name");
        Object label = entry.get("description");
        builder.equation(name == null ? null : name.toString(), label == null ? null : label.toString(), node(entry.get("lhs")),
                         node(entry.get("rhs")));
      }
    } catch (IllegalArgumentException e) {
      throw new IOException("Invalid model in " + origin + ": " + e.getMessage(), e);
    }
    return builder.build();
  }

  private static List<Map<?, ?>> entries(Map<?, ?> data, String key) {
    Object value = data.get(key);
    List<Map<?, ?>> ret = new ArrayList<>();
    if (value == null)
      return ret;
    if (!(value instanceof List))
      throw new IllegalArgumentException("'" + key + "' must be a list");
    for (Object entry : (List<?>)value) {
      if (!(entry instanceof Map))
        throw new IllegalArgumentException("Entries of '" + key + "' must be mappings");
      ret.add((Map<?, ?>)entry);
    }
    return ret;
  }

  private static String text(Map<?, ?> entry, String key) {
    Object value = entry.get(key);
    if (value == null)
      throw new IllegalArgumentException("Missing '" + key + "' in " + entry);
    return value.toString();
  }

  private static String optionalText(Map<?, ?> entry, String key) {
    Object value = entry.get(key);
    return value == null ? "" : value.toString();
  }

  private static List<String> strings(Object value) {
    List<String> ret = new ArrayList<>();
    if (value == null)
      return ret;
    if (!(value instanceof List))
      throw new IllegalArgumentException("Expected a list, got " + value);
    for (Object item : (List<?>)value)
      ret.add(item.toString());
    return ret;
  }

  /** Builds an expression tree from its serialized form. */
  public static Node node(Object value) {
    if (value == null)
      throw new IllegalArgumentException("Missing expression");
    if (value instanceof Number)
      return Node.number(value.toString());
    if (value instanceof String)
      return Node.name((String)value);
    if (!(value instanceof List) || ((List<?>)value).isEmpty())
      throw new IllegalArgumentException("Cannot read expression " + value);
    List<?> list = (List<?>)value;
    String kindName = list.get(0).toString();
    NodeKind kind = NodeKind.fromSerialName(kindName).orElseThrow(() -> new IllegalArgumentException("Unknown node kind " + kindName));
    switch (kind) {
    case Nam:
      expectArgs(list, 1, 2);
      return Node.name(list.get(1).toString(), list.size() > 2 ? strings(list.get(2)) : List.of());
    case Num:
      expectArgs(list, 1, 1);
      return Node.number(list.get(1).toString());
    case Neg:
      expectArgs(list, 1, 1);
      return Node.neg(node(list.get(1)));
    case Log:
      expectArgs(list, 1, 1);
      return Node.log(node(list.get(1)));
    case Exp:
      expectArgs(list, 1, 1);
      return Node.exp(node(list.get(1)));
    case Lag:
      expectArgs(list, 1, 1);
      return Node.lag(node(list.get(1)));
    case Led:
      expectArgs(list, 1, 1);
      return Node.lead(node(list.get(1)));
    case Sum:
      expectArgs(list, 2, 2);
      return Node.sum(list.get(1).toString(), node(list.get(2)));
    case Prd:
      expectArgs(list, 2, 2);
      return Node.prod(list.get(1).toString(), node(list.get(2)));
    case Dom:
      expectArgs(list, 2, 2);
      return Node.domain(node(list.get(1)), strings(list.get(2)));
    case Add:
    case Sub:
    case Mul:
    case Dvd:
    case Pow:
      expectArgs(list, 2, 2);
      return Node.binary(kind, node(list.get(1)), node(list.get(2)));
    default:
      throw new IllegalArgumentException("Node kind " + kindName + " cannot appear in a model file");
    }
  }

  private static void expectArgs(List<?> list, int min, int max) {
    int n = list.size() - 1;
    if (n < min || n > max)
      throw new IllegalArgumentException("Wrong number of arguments in " + list);
  }
}
