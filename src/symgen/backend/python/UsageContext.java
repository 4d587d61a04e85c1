package symgen.backend.python;

import symgen.codegen.SemanticException;

/** Side of the equation and time shift a variable reference appears with. */
public enum UsageContext {
  LagLhs("LHS in lag()", true, -1),
  CurLhs("LHS without lag() or lead()", true, 0),
  LeadLhs("LHS in lead()", true, 1),
  LagRhs("RHS in lag()", false, -1),
  CurRhs("RHS without lag() or lead()", false, 0),
  LeadRhs("RHS in lead()", false, 1);

  public final String description;
  public final boolean lhs;
  public final int dt;

  private UsageContext(String description, boolean lhs, int dt) {
    this.description = description;
    this.lhs = lhs;
    this.dt = dt;
  }

  public static UsageContext of(boolean lhs, int dt) throws SemanticException {
    if (dt < -1)
      throw new SemanticException("lag(lag(var)) cannot be used with msgproc");
    if (dt > 1)
      throw new SemanticException("lead(lead(var)) cannot be used with msgproc");
    for (UsageContext context : values())
      if (context.lhs == lhs && context.dt == dt)
        return context;
    throw new IllegalStateException("No usage context for lhs=" + lhs + ", dt=" + dt);
  }
}
