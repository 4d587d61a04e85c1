package symgen.backend.python;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import symgen.codegen.AllocationException;
import symgen.codegen.SemanticException;
import symgen.frontend.Symbol;
import symgen.frontend.SymbolType;

class VectorRegistryTest {

  VectorRegistry registry;

  static Symbol variable(String name, String... attributes) {
    return new Symbol(name, SymbolType.Variable, "", List.of(), List.of(attributes));
  }

  @BeforeEach
  void setUp() {
    registry = new VectorRegistry();
  }

  @Test
  void testFollowersShareDriverOffsets() throws Exception {
    registry.declare(variable("X", "end", "gdp"), 2);
    VariableSlot y = registry.declare(variable("Y", "ets", "pct"), 3);
    VariableSlot w = registry.declare(variable("W", "stl", "del"), 1);
    VariableSlot s = registry.declare(variable("S", "sta", "idx"), 2);
    VariableSlot z = registry.declare(variable("Z", "end", "gdp"), 4);

    Assertions.assertEquals(2, z.offsetIn(NamedVector.Z1L).get());
    Assertions.assertEquals(2, z.offsetIn(NamedVector.Z1R).get());
    Assertions.assertEquals(0, y.offsetIn(NamedVector.EXZ).get());
    Assertions.assertEquals(0, w.offsetIn(NamedVector.YXR).get());
    Assertions.assertEquals(1, s.offsetIn(NamedVector.X1L).get());
    Assertions.assertEquals(1, s.offsetIn(NamedVector.YXR).get());

    Assertions.assertEquals(6, registry.lengthOf(NamedVector.Z1L));
    Assertions.assertEquals(3, registry.lengthOf(NamedVector.ZEL));
    Assertions.assertEquals(3, registry.lengthOf(NamedVector.X1L));
    Assertions.assertEquals(3, registry.lengthOf(NamedVector.X1R));
    Assertions.assertEquals(0, registry.lengthOf(NamedVector.J1L));
    Assertions.assertEquals(12, VectorRegistry.endogenousCount(registry.slots()));
  }

  @Test
  void testLocate() throws Exception {
    registry.declare(variable("A", "end", "gdp"), 1);
    registry.declare(variable("X", "end", "gdp"), 4);
    registry.declare(new Symbol("alpha", SymbolType.Parameter, "", List.of(), List.of()), 2);

    Assertions.assertEquals("z1l[3]", registry.locate("X", 2, UsageContext.CurLhs).toString());
    Assertions.assertEquals("z1r[4]", registry.locate("x", 3, UsageContext.CurRhs).toString());
    Assertions.assertEquals("par[1]", registry.locate("alpha", 1, UsageContext.CurRhs).toString());
    Assertions.assertThrows(SemanticException.class, () -> registry.locate("X", 4, UsageContext.CurRhs));
    Assertions.assertThrows(SemanticException.class, () -> registry.locate("missing", 0, UsageContext.CurRhs));
  }

  @Test
  void testIllegalContext() throws Exception {
    registry.declare(variable("E", "exo", "gdp"), 1);
    var e = Assertions.assertThrows(SemanticException.class, () -> registry.locate("E", 0, UsageContext.LeadLhs));
    Assertions.assertEquals("Invalid context for variable E: Type 'exo' on LHS in lead()", e.getMessage());
  }

  @ParameterizedTest
  @EnumSource(VariableType.class)
  void testLegalContextsResolve(VariableType type) throws Exception {
    Symbol symbol = type == VariableType.Par ? new Symbol("v", SymbolType.Parameter, "", List.of(), List.of())
                                             : variable("v", type.tag, "gdp");
    registry.declare(symbol, 1);
    for (UsageContext context : UsageContext.values()) {
      if (type.vectorFor(context).isPresent())
        Assertions.assertEquals(type.vectorFor(context).get(), registry.locate("v", 0, context).vector());
      else
        Assertions.assertThrows(SemanticException.class, () -> registry.locate("v", 0, context));
    }
  }

  @Test
  void testFollowerWithoutDriver() {
    VariableSlot slot = new VariableSlot(variable("X", "end", "gdp"), VariableType.End, "gdp", 1);
    var e = Assertions.assertThrows(AllocationException.class, () -> registry.allocate(slot, UsageContext.CurRhs));
    Assertions.assertEquals("Z1R without Z1L", e.getMessage());
  }

  @Test
  void testDuplicateNamesIgnoreCase() throws Exception {
    registry.declare(variable("Price", "end", "gdp"), 1);
    Assertions.assertThrows(SemanticException.class, () -> registry.declare(variable("PRICE", "end", "gdp"), 1));
  }

  @Test
  void testTypeAndUnitAreRequired() {
    var multiple = Assertions.assertThrows(SemanticException.class, () -> registry.declare(variable("X", "end", "exo", "gdp"), 1));
    Assertions.assertEquals("Multiple variable types for variable: X", multiple.getMessage());
    var none = Assertions.assertThrows(SemanticException.class, () -> registry.declare(variable("X", "gdp"), 1));
    Assertions.assertEquals("No type declared for variable X", none.getMessage());
    var noUnit = Assertions.assertThrows(SemanticException.class, () -> registry.declare(variable("X", "end", "N001"), 1));
    Assertions.assertEquals("No units given for variable X with attributes end,N001", noUnit.getMessage());
  }

  @Test
  void testUsageContext() throws Exception {
    Assertions.assertEquals(UsageContext.LagRhs, UsageContext.of(false, -1));
    Assertions.assertEquals(UsageContext.CurLhs, UsageContext.of(true, 0));
    Assertions.assertThrows(SemanticException.class, () -> UsageContext.of(false, -2));
    Assertions.assertThrows(SemanticException.class, () -> UsageContext.of(true, 2));
  }
}
