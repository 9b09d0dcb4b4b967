package io.uniqints.sketch;

/**
 * Thrown when two sketches with a different number of registers are merged.
 */
public class SketchSizeMismatchException extends IllegalArgumentException
{
  private final int expectedRegisters;
  private final int actualRegisters;

  public SketchSizeMismatchException(int expectedRegisters, int actualRegisters)
  {
    super(String.format(
        "cannot merge sketch with %,d registers into sketch with %,d registers",
        actualRegisters,
        expectedRegisters
    ));
    this.expectedRegisters = expectedRegisters;
    this.actualRegisters = actualRegisters;
  }

  public int getExpectedRegisters()
  {
    return expectedRegisters;
  }

  public int getActualRegisters()
  {
    return actualRegisters;
  }
}
