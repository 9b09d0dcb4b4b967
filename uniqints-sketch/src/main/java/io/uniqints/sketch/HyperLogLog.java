package io.uniqints.sketch;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Implements HyperLogLog described in http://algo.inria.fr/flajolet/Publications/FlFuGaMe07.pdf.
 *
 * <p>Uses a 32-bits hash with a parameter p, giving m = 2^p registers and an expected relative
 * error of about {@code 1.04 / sqrt(m)}:
 * <pre>
 * p[4],  m[16]     =&gt; error[26.0%]
 * p[10], m[1,024]  =&gt; error[3.25%]
 * p[14], m[16,384] =&gt; error[0.81%]
 * p[16], m[65,536] =&gt; error[0.41%]
 * </pre>
 *
 * <p>The low p bits of the hash select the register, the rank stored is the 1-based position of the
 * leftmost one in the remaining 32-p bits ({@code 32-p+1} when they are all zero).
 *
 * <p>Each register takes 8-bits instead of 5-bits.
 */
public class HyperLogLog implements CardinalityEstimator<HyperLogLog>
{
  public static final int MIN_PRECISION = 4;
  public static final int MAX_PRECISION = 16;

  private static final double TWO_TO_THE_THIRTY_TWO = Math.pow(2, 32);
  private static final double HIGH_CORRECTION_THRESHOLD = TWO_TO_THE_THIRTY_TWO / 30.0d;

  private final int p;
  private final HashFunction hashFunction;

  // each register actually only needs 5-bits,
  // we use `byte` here to simplify implementation
  private final byte[] registers;

  public HyperLogLog(int precision)
  {
    this(precision, Hashing.murmur3_128());
  }

  public HyperLogLog(int precision, HashFunction hashFunction)
  {
    Preconditions.checkArgument(
        precision >= MIN_PRECISION && precision <= MAX_PRECISION,
        "invalid precision [%s] : should be in [%s, %s]",
        precision,
        MIN_PRECISION,
        MAX_PRECISION
    );
    Preconditions.checkArgument(hashFunction.bits() >= Integer.SIZE, "hash function must produce at least 32 bits");
    this.p = precision;
    this.hashFunction = hashFunction;
    this.registers = new byte[1 << p];
  }

  /**
   * Builds a new sketch holding the union of {@code a} and {@code b}. Neither input is modified.
   *
   * @throws SketchSizeMismatchException if the sketches do not have the same number of registers
   */
  public static HyperLogLog union(HyperLogLog a, HyperLogLog b)
  {
    HyperLogLog result = a.copy();
    result.merge(b);
    return result;
  }

  @Override
  public void add(byte[] value)
  {
    add32BitsHash(fold(hashFunction.hashBytes(value)));
  }

  @Override
  public void add(long value)
  {
    add32BitsHash(fold(hashFunction.hashLong(value)));
  }

  // xor of the first two 32-bit words; the first word alone is biased for some murmur3 seeds
  static int fold(HashCode code)
  {
    final long h = code.padToLong();
    return (int) (h ^ (h >>> 32));
  }

  private void add32BitsHash(int hash)
  {
    final int bucket = hash & ((1 << p) - 1);
    final int remaining = hash >>> p;

    // the top p bits of `remaining` are always zero
    byte rank = (byte) (Integer.numberOfLeadingZeros(remaining) - p + 1);

    // note that both operands can never be negative, so we don't need to use unsigned comparison
    if (registers[bucket] < rank) {
      registers[bucket] = rank;
    }
  }

  @Override
  public void merge(HyperLogLog that)
  {
    if (this.p != that.p) {
      throw new SketchSizeMismatchException(registers.length, that.registers.length);
    }
    Preconditions.checkArgument(
        hashFunction.equals(that.hashFunction),
        "cannot merge sketches built with different hash functions: %s vs %s",
        hashFunction,
        that.hashFunction
    );
    for (int i = 0; i < registers.length; i++) {
      if (registers[i] < that.registers[i]) {
        registers[i] = that.registers[i];
      }
    }
  }

  @Override
  public double estimate()
  {
    final int m = registers.length;

    double registerSum = 0.0;
    int zeros = 0;
    for (int i = 0; i < m; i++) {
      registerSum += 1.0 / (1 << registers[i]);
      if (registers[i] == 0) {
        zeros++;
      }
    }

    final double e = alpha(m) * m * m * (1 / registerSum);
    return makeCorrection(e, zeros, m);
  }

  private static double alpha(int m)
  {
    switch (m) {
      case 16:
        return 0.673;
      case 32:
        return 0.697;
      case 64:
        return 0.709;
      default:
        return 0.7213 / (1 + 1.079 / m);
    }
  }

  static double makeCorrection(double e, int zeros, int m)
  {
    if (e <= (2.5d * m)) { // small range correction
      return zeros == 0 ? e : m * Math.log(m / (double) zeros);
    }

    if (e >= TWO_TO_THE_THIRTY_TWO) { // hash space saturated, the correction is undefined
      return e;
    }

    if (e > HIGH_CORRECTION_THRESHOLD) { // high range correction
      return -TWO_TO_THE_THIRTY_TWO * Math.log(1 - e / TWO_TO_THE_THIRTY_TWO);
    }

    return e;
  }

  public HyperLogLog copy()
  {
    HyperLogLog copy = new HyperLogLog(p, hashFunction);
    System.arraycopy(registers, 0, copy.registers, 0, registers.length);
    return copy;
  }

  public int precision()
  {
    return p;
  }

  public int registerCount()
  {
    return registers.length;
  }

  public int register(int index)
  {
    Preconditions.checkElementIndex(index, registers.length);
    return registers[index];
  }

  @Override
  public long memoryFootprint()
  {
    return registers.length; // not counting object headers, `p`, `hashFunction` reference
  }

  @Override
  public String name()
  {
    return "hll" + p;
  }

  @Override
  public String toString()
  {
    return "HyperLogLog{p=" + p + ", m=" + registers.length + ", hash=" + hashFunction + "}";
  }
}
