package io.uniqints.sketch;

import com.google.common.base.Supplier;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Measures how far an estimator drifts from the true distinct count as the stream grows.
 */
public class CardinalityEstimatorAccuracy
{
  private static final int RANDOM_SET_LIMIT = 100_000;

  /**
   * Run estimation on random generated data set of cardinality {1*fromCard, 2*fromCard, 3*fromCard, .., toCard}.
   * `numRuns` experiments will be run for each cardinality, run i is seeded with {@code seed + i}.
   *
   * @return absolute percentage errors for each experiment, errors[i][j] = error at cardinality (i+1)*fromCard of
   * the j-th run.
   */
  static double[][] measureErrors(
      Supplier<? extends CardinalityEstimator<?>> estimatorSupplier,
      final int fromCard,
      final int toCard,
      final int numRuns,
      final long seed
  )
  {
    if (fromCard <= 0 || toCard <= fromCard || toCard % fromCard != 0) {
      throw new IllegalArgumentException("illegal from \"" + fromCard + "\" and to \"" + toCard + "\"");
    }
    if (numRuns <= 0) {
      throw new IllegalArgumentException("illegal runs \"" + numRuns + "\"");
    }
    final int numCard = toCard / fromCard;

    double[][] errors = new double[numCard][];
    for (int i = 0; i < numCard; i++) {
      errors[i] = new double[numRuns];
    }

    for (int run = 0; run < numRuns; run++) {
      // reset estimator at the beginning of each run
      CardinalityEstimator<?> estimator = estimatorSupplier.get();
      Random random = new Random(seed + run);
      // for low cardinality tests, draw random values and let an exact counter reject repeats,
      // above that the exact set gets too big and a bijective mix of a counter is used instead
      ExactCounter seen = toCard <= RANDOM_SET_LIMIT ? new ExactCounter() : null;
      final long base = random.nextLong();

      for (int card = 1; card <= toCard; card++) {
        long value;
        if (seen != null) {
          do {
            value = random.nextLong();
          } while (seen.contains(value));
          seen.add(value);
        } else {
          value = mix64(base + card);
        }

        estimator.add(value);

        if (card % fromCard == 0) {
          double est = estimator.estimate();
          double error = 100.0 * (est - card) / card;
          errors[card / fromCard - 1][run] = Math.abs(error);
        }
      }
    }

    return errors;
  }

  // MurmurHash3 64-bit finalizer, a bijection on longs
  private static long mix64(long k)
  {
    k ^= k >>> 33;
    k *= 0xff51afd7ed558ccdL;
    k ^= k >>> 33;
    k *= 0xc4ceb9fe1a85ec53L;
    k ^= k >>> 33;
    return k;
  }

  static List<OneResult> summarize(int fromCard, double[][] errors)
  {
    List<OneResult> results = new ArrayList<>(errors.length);
    for (int i = 0; i < errors.length; i++) {
      long cardinality = (long) (i + 1) * fromCard;
      results.add(OneResult.from(cardinality, errors[i]));
    }
    return results;
  }

  public static void main(String[] args) throws IOException
  {
    if (args.length < 4 || args.length > 5) {
      System.err.println("Arguments: <estimator> <from> <to> <runs> [<outFile>]");
      System.exit(1);
    }

    Supplier<CardinalityEstimator<?>> estimatorSupplier = CardinalityEstimators.lazyGet(args[0]);
    final int fromCard = Integer.parseInt(args[1]);
    final int toCard = Integer.parseInt(args[2]);
    final int numRuns = Integer.parseInt(args[3]);

    Path outFile;
    if (args.length == 5) {
      outFile = Paths.get(args[4]);
    } else {
      outFile = Paths.get(String.format("%s_%d_%d_%d.tsv", args[0], fromCard, toCard, numRuns));
    }

    final long start = System.currentTimeMillis();
    final double[][] errors = measureErrors(estimatorSupplier, fromCard, toCard, numRuns, System.nanoTime());
    System.out.printf("Finished %d runs in %,d ms%n", numRuns, System.currentTimeMillis() - start);

    // compute min, 50%, max error for each cardinality
    List<OneResult> results = summarize(fromCard, errors);

    System.out.println("Writing results to " + outFile);
    try (BufferedWriter writer = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8)) {
      writer.write("Card\tMin\tMedian\tMax\n");
      for (OneResult result : results) {
        writer.write(String.format(
            "%d\t%.3f\t%.3f\t%.3f\n",
            result.cardinality,
            result.minError,
            result.medianError,
            result.maxError
        ));
      }
    }
  }

  static class OneResult
  {
    final long cardinality;
    final double minError;
    final double medianError;
    final double maxError;

    OneResult(long cardinality, double minError, double medianError, double maxError)
    {
      this.cardinality = cardinality;
      this.minError = minError;
      this.medianError = medianError;
      this.maxError = maxError;
    }

    static OneResult from(long cardinality, double[] errors)
    {
      double[] sorted = errors.clone();
      Arrays.sort(sorted);
      return new OneResult(
          cardinality,
          sorted[0],
          sorted[sorted.length / 2],
          sorted[sorted.length - 1]
      );
    }
  }
}
