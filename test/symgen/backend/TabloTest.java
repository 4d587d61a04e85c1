package symgen.backend;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import symgen.SymGen;
import symgen.codegen.GenerationSession;
import symgen.codegen.SemanticException;
import symgen.frontend.Model;
import symgen.frontend.Node;
import symgen.ui.SymGenConfig;
import symgen.util.OutputFiles;

class TabloTest {

  @TempDir Path dir;

  static Model tradeModel() {
    return new Model.Builder()
        .set("regions", "Regions", List.of("US", "EU"))
        .parameter("alpha", "Share", List.of("regions"), List.of("P001"))
        .variable("X", "Output", List.of("regions"), List.of("N001"))
        .variable("Y", "Demand", List.of("regions"), List.of("X001"))
        .equation("eq_x", "Output", Node.name("X", "regions"), Node.mul(Node.name("alpha", "regions"), Node.name("Y", "regions")))
        .build();
  }

  String read(String suffix) throws Exception { return Files.readString(dir.resolve("m" + suffix)); }

  @Test
  void testLevelsModel() throws Exception {
    Assertions.assertTrue(new SymGen().generate(Lang.Tablo, tradeModel(), dir, "m"));
    String code = read(".tab");
    Assertions.assertTrue(code.startsWith("equation    (default=levels)       ;\n"), code);
    Assertions.assertTrue(code.contains("set regions (US,EU) ;\n"), code);
    Assertions.assertTrue(code.contains("coefficient (all,r,regions) alpha(r) ;\n"), code);
    Assertions.assertTrue(code.contains("file param ;\n"), code);
    Assertions.assertTrue(code.contains("read (all,r,regions) \n   alpha(r) from file param header \"P001\" ;\n"), code);
    Assertions.assertTrue(code.contains("variable (all,r,regions) X(r) ;\n"), code);
    Assertions.assertTrue(code.contains("file endog ;\nfile exog ;\n"), code);
    Assertions.assertTrue(code.contains("read (all,r,regions) \n   Y(r) from file exog header \"X001\" ;\n"), code);
    Assertions.assertTrue(code.contains("\nequation eq_x (all,r,regions) \n   X(r) = alpha(r)*Y(r) ;\n"), code);

    String info = read(".lis");
    Assertions.assertTrue(info.contains("   Equations: 2\n"), info);
    Assertions.assertTrue(info.contains("   Endogenous variables: 2\n"), info);
    Assertions.assertTrue(info.contains("      Equations and variables match\n"), info);
    Assertions.assertTrue(info.contains("   Exogenous variables: 2\n"), info);
  }

  @Test
  void testCalcMode() throws Exception {
    SymGenConfig config = new SymGenConfig();
    config.calcMode = true;
    Assertions.assertTrue(new SymGen(config).generate(Lang.Tablo, tradeModel(), dir, "m"));
    String code = read(".tab");
    Assertions.assertTrue(code.startsWith("formula     (default=initial)      ;\n"), code);
    Assertions.assertTrue(code.contains("coefficient (all,r,regions) X(r) ;\n"), code);
    // X is only computed, Y is read
    Assertions.assertFalse(code.contains("X(r) from file"), code);
    Assertions.assertTrue(code.contains("Y(r) from file exog header \"X001\""), code);
    Assertions.assertTrue(code.contains("\nformula (all,r,regions) \n   X(r) = alpha(r)*Y(r) ;\n"), code);
    Assertions.assertTrue(code.contains("\nfile (new) calc ;\n\nwrite (all,r,regions) \n   X(r) to file calc header \"N001\" ;\n"), code);
  }

  @Test
  void testTimeOffsets() throws Exception {
    Model model = new Model.Builder()
                      .set("time", "Periods", List.of("t1", "t2", "t3"))
                      .variable("K", "Capital", List.of("time"), List.of("N002"))
                      .equation("eq_k", null, Node.name("K", "time"), Node.add(Node.lag(Node.name("K", "time")), Node.number(1)))
                      .build();
    Assertions.assertTrue(new SymGen().generate(Lang.Tablo, model, dir, "m"));
    String code = read(".tab");
    Assertions.assertTrue(code.contains("set (intertemporal) time (t1,t2,t3) ;\n"), code);
    Assertions.assertTrue(code.contains("K(t) = K(t-1)+1 ;\n"), code);
  }

  @Test
  void testHeaderRequired() throws Exception {
    Model model = new Model.Builder()
                      .variable("Z", "", List.of(), List.of())
                      .equation(null, null, Node.name("Z"), Node.number(1))
                      .build();
    OutputFiles files = new OutputFiles(dir, "m");
    Tablo backend = new Tablo();
    backend.prepare(new GenerationSession(model, new SymGenConfig(), files, backend.codeExtension()));
    var e = Assertions.assertThrows(SemanticException.class, () -> backend.writeFile("m"));
    Assertions.assertEquals("Header required for symbol: Z", e.getMessage());
    files.discard();
  }

  @Test
  void testDeclarationsWithoutEquations() throws Exception {
    Model model = new Model.Builder().set("regions", "", List.of("US")).variable("X", "", List.of("regions"), List.of("N001")).build();
    Assertions.assertTrue(new SymGen().generate(Lang.Tablo, model, dir, "m"));
    Assertions.assertTrue(read(".tab").contains("variable (all,r,regions) X(r) ;\n"));
    Assertions.assertTrue(read(".lis").contains("   Variables, Unused: 1\n"));
  }
}
