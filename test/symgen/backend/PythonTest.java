package symgen.backend;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import symgen.SymGen;
import symgen.TestModels;
import symgen.codegen.GenerationSession;
import symgen.codegen.SemanticException;
import symgen.frontend.Model;
import symgen.frontend.Node;
import symgen.ui.SymGenConfig;
import symgen.util.OutputFiles;

class PythonTest {

  @TempDir Path dir;

  String read(String suffix) throws Exception { return Files.readString(dir.resolve("m" + suffix)); }

  @Test
  void testBalancedModel() throws Exception {
    Assertions.assertTrue(new SymGen().generate(Lang.Python, TestModels.threeEndogenous(3), dir, "m"));

    String code = read(".py");
    Assertions.assertTrue(code.startsWith("import numpy as np\nfrom math import exp\nfrom math import log\n\n\ndef msgproc("), code);
    Assertions.assertTrue(code.contains("    # Equation block 1\n    #    Scalar equations 1-1 (1 total)\n\n    z1l[0] = par[0]*z1r[1]\n\n"),
                          code);
    Assertions.assertTrue(code.contains("    z1l[1] = z1r[2]+1\n\n"), code);
    Assertions.assertTrue(code.contains("    z1l[2] = 2\n\n"), code);
    Assertions.assertTrue(code.endsWith("\n# END OF MSGPROC function declaration\n"), code);

    String info = read(".lis");
    Assertions.assertTrue(info.contains("   z1l has 3 elements\n"), info);
    Assertions.assertTrue(info.contains("   par has 1 elements\n"), info);
    Assertions.assertTrue(info.contains("Equation Count: 3\nEndogenous Variables, Used:   3\nEndogenous Variables, Total:  3\n"), info);

    Assertions.assertEquals("\"alpha\",1,par,,\"Share\",\"P001\"\n\"A\",1,end,gdp,\"First\",\"end,gdp\"\n"
                                + "\"B\",1,end,pct,\"Second\",\"end,pct\"\n\"C\",1,end,idx,\"Third\",\"end,idx\"\n",
                            read("_varinfo.csv"));
    Assertions.assertEquals("1,\"A()\",\"First\",\"gdp\",\"USA\",\n2,\"B()\",\"Second\",\"pct\",\"USA\",\n3,\"C()\",\"Third\",\"idx\",\"USA\",\n",
                            read("_vars.csv"));
    Assertions.assertTrue(read("_varmap.csv").startsWith("\"alpha()\",\"par[0]\",par,0\n\"A()\",\"z1l[0]\",z1l,0\n\"A()\",\"z1r[0]\",z1r,0\n"));
    Assertions.assertTrue(read("_optmap.csv").startsWith("0,\"par[0]\",par,0,0\n1,\"z1l[0]\",z1l,0\n1,\"z1r[0]\",z1r,0\n2,\"z1l[1]\",z1l,1\n"));
  }

  @Test
  void testMissingEquationFailsWithoutOutput() throws Exception {
    Assertions.assertFalse(new SymGen().generate(Lang.Python, TestModels.threeEndogenous(2), dir, "m"));
    try (Stream<Path> left = Files.list(dir)) {
      Assertions.assertEquals(0, left.count());
    }
  }

  @Test
  void testModelWithoutEquationsReconciles() throws Exception {
    // every endogenous variable is unused
    Assertions.assertTrue(new SymGen().generate(Lang.Python, TestModels.threeEndogenous(0), dir, "m"));
    Assertions.assertTrue(read(".lis").contains("Equation Count: 0\nEndogenous Variables, Used:   0\nEndogenous Variables, Total:  3\n"));
  }

  @Test
  void testLagsOverTime() throws Exception {
    Assertions.assertTrue(new SymGen().generate(Lang.Python, TestModels.capitalOverTime(), dir, "m"));
    String code = read(".py");
    Assertions.assertTrue(code.contains("    # Equation block 1\n    #    Defined over sets (time)\n    #    Scalar equations 1-3 (3 total)\n\n"),
                          code);
    Assertions.assertTrue(code.contains("    x1l[0] = yxr[0]+exo[0]\n\n"), code);
    Assertions.assertTrue(code.contains("    x1l[2] = yxr[2]+exo[2]\n\n"), code);
    Assertions.assertTrue(read("_varmap.csv").contains("\"K(t2)\",\"x1r[1]\",x1r,1\n"));
  }

  @Test
  void testDuplicateNameDiffersOnlyInCase() {
    Model model = new Model.Builder()
                      .variable("Price", "", List.of(), List.of("end", "gdp"))
                      .variable("PRICE", "", List.of(), List.of("end", "gdp"))
                      .equation(null, null, Node.name("Price"), Node.number(1))
                      .equation(null, null, Node.name("PRICE"), Node.number(1))
                      .build();
    Assertions.assertFalse(new SymGen().generate(Lang.Python, model, dir, "m"));
  }

  @Test
  void testExogenousOnLeftSide() throws Exception {
    Model model = new Model.Builder()
                      .variable("E", "", List.of(), List.of("exo", "gdp"))
                      .equation(null, null, Node.name("E"), Node.number(1))
                      .build();
    OutputFiles files = new OutputFiles(dir, "m");
    Python backend = new Python();
    backend.prepare(new GenerationSession(model, new SymGenConfig(), files, backend.codeExtension()));
    var e = Assertions.assertThrows(SemanticException.class, () -> backend.writeFile("m"));
    Assertions.assertEquals("Invalid context for variable E: Type 'exo' on LHS without lag() or lead()", e.getMessage());
    files.discard();
  }

  @Test
  void testElementIndexIsRowMajor() throws Exception {
    Model model = new Model.Builder()
                      .set("regions", "", List.of("US", "EU"))
                      .set("goods", "", List.of("A", "B", "C"))
                      .variable("X", "", List.of("regions", "goods"), List.of("end", "gdp"))
                      .build();
    OutputFiles files = new OutputFiles(dir, "m");
    Python backend = new Python();
    backend.prepare(new GenerationSession(model, new SymGenConfig(), files, backend.codeExtension()));
    var x = model.lookup("X").get();
    Assertions.assertEquals(0, backend.elementIndex(x, List.of("US", "A")));
    Assertions.assertEquals(5, backend.elementIndex(x, List.of("EU", "C")));
    Assertions.assertEquals(4, backend.elementIndex(x, List.of("EU", "B")));
    Assertions.assertThrows(SemanticException.class, () -> backend.elementIndex(x, List.of("JP", "A")));
    files.discard();
  }
}
