package symgen.codegen;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import symgen.TestModels;
import symgen.backend.LangBackend;
import symgen.frontend.Equation;
import symgen.frontend.Model;
import symgen.frontend.Node;
import symgen.frontend.ProductEnumerator;
import symgen.ui.SymGenConfig;
import symgen.util.OutputFiles;

class EquationWriterTest {

  @TempDir Path dir;

  /** Default rendering with selectable styles; remembers the hooks it saw. */
  static class RecordingBackend extends LangBackend {
    final Style style;
    final boolean skips;
    final List<String> calls = new ArrayList<>();
    final List<List<String>> written = new ArrayList<>();

    RecordingBackend(Style style, boolean skips) {
      this.style = style;
      this.skips = skips;
    }

    @Override
    public void prepare(GenerationSession session) {
      super.prepare(session);
      if (style != null) {
        session.setEquationStyle(style);
        session.setSumStyle(style);
      }
    }

    @Override
    public boolean skipsInvalidEquations() {
      return skips;
    }

    @Override
    public void beginFile(String basename) {
      calls.add("beginFile");
    }

    @Override
    public void declare(symgen.frontend.Symbol symbol) {
      calls.add("declare " + symbol.name());
    }

    @Override
    public void beginBlock(Equation eq) {
      calls.add("beginBlock " + eq.getNumber());
    }

    @Override
    public void showEq(Equation eq, List<String> sets, List<String> subs) throws GenerationException {
      written.add(subs);
      super.showEq(eq, sets, subs);
    }

    @Override
    public void endFile() {
      calls.add("endFile");
    }
  }

  GenerationSession session(Model model, OutputFiles files) throws OutputException {
    return new GenerationSession(model, new SymGenConfig(), files, "txt");
  }

  @Test
  void testScalarEquationsInProductOrder() throws Exception {
    OutputFiles files = new OutputFiles(dir, "scalar");
    RecordingBackend backend = new RecordingBackend(Style.Scalar, true);
    backend.prepare(session(TestModels.regionsByGoods(), files));
    backend.writeFile("scalar");
    files.commit();

    Assertions.assertEquals(List.of(List.of("US", "A"), List.of("US", "B"), List.of("US", "C"), List.of("EU", "A"), List.of("EU", "B"),
                                    List.of("EU", "C")),
                            backend.written);
    Assertions.assertEquals(List.of("beginFile", "declare R", "declare G", "declare X", "beginBlock 1", "endFile"), backend.calls);
    String code = Files.readString(files.pathOf(".txt"));
    Assertions.assertTrue(code.startsWith("X(US,A) = 1 ;\n\nX(US,B) = 1 ;\n\n"), code);
    Assertions.assertTrue(Files.exists(files.pathOf(".lis")));
  }

  @Test
  void testVectorEquationWrittenOnce() throws Exception {
    OutputFiles files = new OutputFiles(dir, "vector");
    RecordingBackend backend = new RecordingBackend(Style.Vector, true);
    backend.prepare(session(TestModels.regionsByGoods(), files));
    backend.writeFile("vector");
    files.commit();

    Assertions.assertEquals(List.of(List.of(NodeRenderer.ALL_ELEMENTS, NodeRenderer.ALL_ELEMENTS)), backend.written);
    Assertions.assertEquals("X(R,G) = 1 ;\n\n", Files.readString(files.pathOf(".txt")));
  }

  @Test
  void testStyleMustBeSelected() throws Exception {
    OutputFiles files = new OutputFiles(dir, "nostyle");
    RecordingBackend backend = new RecordingBackend(null, true);
    backend.prepare(session(TestModels.regionsByGoods(), files));
    var e = Assertions.assertThrows(ConfigurationException.class, () -> backend.writeFile("nostyle"));
    Assertions.assertEquals("Equation style has not been set", e.getMessage());
    files.discard();
  }

  @Test
  void testEnumerationMismatchIsReported() throws Exception {
    Model model = TestModels.regionsByGoods();
    ProductEnumerator truncated = (sets, alphabetic) -> List.of(List.of("US", "A"));
    OutputFiles files = new OutputFiles(dir, "mismatch");
    RecordingBackend backend = new RecordingBackend(Style.Scalar, true);
    backend.prepare(new GenerationSession(model, model, truncated, new SymGenConfig(), files, "txt"));
    var e = Assertions.assertThrows(ConsistencyException.class, () -> backend.writeFile("mismatch"));
    Assertions.assertTrue(e.getMessage().contains("expected 6, wrote 1"), e.getMessage());
    files.discard();
  }

  @Test
  void testInvalidEquationsSkippedByPolicy() throws Exception {
    Model model = new Model.Builder()
                      .variable("A", "", List.of(), List.of())
                      .equation(null, null, Node.name("A"), Node.name("Undeclared"))
                      .equation(null, null, Node.name("A"), Node.lag(Node.add(Node.name("A"), Node.number(1))))
                      .equation(null, null, Node.name("A"), Node.number(3))
                      .build();

    OutputFiles files = new OutputFiles(dir, "skip");
    RecordingBackend skipping = new RecordingBackend(Style.Vector, true);
    skipping.prepare(session(model, files));
    skipping.writeFile("skip");
    files.discard();
    Assertions.assertEquals(List.of("beginFile", "declare A", "beginBlock 3", "endFile"), skipping.calls);

    OutputFiles files2 = new OutputFiles(dir, "keep");
    RecordingBackend keeping = new RecordingBackend(Style.Vector, false);
    keeping.prepare(session(model, files2));
    keeping.writeFile("keep");
    files2.discard();
    Assertions.assertEquals(List.of("beginFile", "declare A", "beginBlock 1", "beginBlock 2", "beginBlock 3", "endFile"), keeping.calls);
  }

  @Test
  void testNormalizedForm() throws Exception {
    OutputFiles files = new OutputFiles(dir, "norm");
    SymGenConfig config = new SymGenConfig();
    config.normalized = true;
    RecordingBackend backend = new RecordingBackend(Style.Vector, true);
    backend.prepare(new GenerationSession(TestModels.regionsByGoods(), config, files, "txt"));
    backend.writeFile("norm");
    files.commit();
    Assertions.assertEquals("X(R,G) - (1) ;\n\n", Files.readString(files.pathOf(".txt")));
  }
}
