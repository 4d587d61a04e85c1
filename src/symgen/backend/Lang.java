package symgen.backend;

import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Selectable output targets.
 */
public enum Lang {
  /** HTML documentation with MathJax equations. */
  Html("html", () -> new symgen.backend.Html()),
  /** Python simulation code over numbered vectors. */
  Python("python", () -> new symgen.backend.Python()),
  /** GEMPACK TABLO model file. */
  Tablo("tablo", () -> new symgen.backend.Tablo());

  public final String serialName;
  private final Supplier<LangBackend> factory;
  private Lang(String serialName, Supplier<LangBackend> factory) {
    this.serialName = serialName;
    this.factory = factory;
  }

  /** Fresh backend instance for one run. */
  public LangBackend create() { return factory.get(); }

  public static Optional<Lang> fromSerialName(String name) {
    return Stream.of(Lang.values()).filter(lang -> lang.serialName.equalsIgnoreCase(name)).findAny();
  }
}
