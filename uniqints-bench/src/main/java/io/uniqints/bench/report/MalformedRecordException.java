package io.uniqints.bench.report;

/**
 * A benchmark log line could not be turned into a record. Parsing stops at the first such line.
 */
public class MalformedRecordException extends RuntimeException
{
  private final int lineNumber;
  private final String line;

  public MalformedRecordException(int lineNumber, String line, String reason)
  {
    this(lineNumber, line, reason, null);
  }

  public MalformedRecordException(int lineNumber, String line, String reason, Throwable cause)
  {
    super("line " + lineNumber + ": " + reason + " [" + line + "]", cause);
    this.lineNumber = lineNumber;
    this.line = line;
  }

  /**
   * @return 1-based line number, 0 when the record did not come from a parsed line
   */
  public int getLineNumber()
  {
    return lineNumber;
  }

  public String getLine()
  {
    return line;
  }
}
