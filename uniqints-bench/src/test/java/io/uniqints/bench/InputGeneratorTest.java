package io.uniqints.bench;

import org.junit.Test;

import java.util.Random;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class InputGeneratorTest
{
  @Test
  public void testRandomSignedRange()
  {
    int[] values = InputGenerator.randomSigned(10_000, 50, new Random(2));
    assertEquals(10_000, values.length);
    boolean negative = false;
    boolean positive = false;
    for (int value : values) {
      assertTrue(String.valueOf(value), value > -50 && value < 50);
      negative |= value < 0;
      positive |= value > 0;
    }
    assertTrue(negative && positive);
  }

  @Test
  public void testSeededIsReproducible()
  {
    assertArrayEquals(
        InputGenerator.randomSigned(100, 1000, new Random(9)),
        InputGenerator.randomSigned(100, 1000, new Random(9))
    );
  }

  @Test
  public void testForBenchmark()
  {
    assertArrayEquals(InputGenerator.sample(), InputGenerator.forBenchmark(10, new Random(0)));
    int[] values = InputGenerator.forBenchmark(100, new Random(0));
    assertEquals(100, values.length);
    for (int value : values) {
      assertTrue(Math.abs(value) < 1000);
    }
  }

  @Test
  public void testSampleIsACopy()
  {
    int[] sample = InputGenerator.sample();
    sample[0] = -1;
    assertEquals(16, InputGenerator.sample()[0]);
  }

  @Test
  public void testGrowing()
  {
    assertArrayEquals(new int[]{0, 1, 2, 3}, InputGenerator.growing(4));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsEmptySize()
  {
    InputGenerator.randomSigned(0, 10, new Random());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsNonPositiveMax()
  {
    InputGenerator.randomSigned(10, 0, new Random());
  }
}
