package symgen.codegen;

/**
 * Reflows text to a maximum width. Breaks go immediately after whitespace, an arithmetic or relational operator, or,
 * where allowed, a comma; the continuation line is indented by three spaces. Embedded newlines are kept.
 */
public final class LineWrapper {
  private LineWrapper() {}

  public static final String CONTINUATION = "\n   ";

  /**
   * @param line text to wrap
   * @param width maximum length of each piece, not counting the continuation indent
   * @param addNewline terminate the result with a newline
   * @param commaOk commas are safe break points
   * @throws FormatException if a piece longer than {@code width} has no safe break point
   */
  public static String wrap(String line, int width, boolean addNewline, boolean commaOk) throws FormatException {
    StringBuilder out = new StringBuilder();
    String rest = line;
    while (true) {
      if (rest.length() <= width) {
        out.append(rest);
        if (addNewline)
          out.append('\n');
        return out.toString();
      }

      int newline = rest.indexOf('\n');
      if (newline >= 0 && newline <= width) {
        out.append(rest, 0, newline + 1);
        rest = rest.substring(newline + 1);
        continue;
      }

      int end = width - 1;
      while (end > 0 && !isBreakAfter(rest.charAt(end), commaOk))
        --end;
      if (end <= 0)
        throw new FormatException("Could not wrap long line:\n" + line);

      out.append(rest, 0, end + 1).append(CONTINUATION);
      rest = rest.substring(end + 1);
    }
  }

  /** True if a line may end right after {@code c}. */
  public static boolean isBreakAfter(char c, boolean commaOk) {
    return Character.isWhitespace(c) || c == '+' || c == '-' || c == '*' || c == '/' || c == '=' || c == '^' || (commaOk && c == ',');
  }
}
