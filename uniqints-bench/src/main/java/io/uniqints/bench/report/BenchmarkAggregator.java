package io.uniqints.bench.report;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns a benchmark log into a {@link ResultTable} of durations in microseconds.
 *
 * <p>The log is a sequence of groups:
 * <pre>
 * Benchmark for array size 1000
 * Benchmark for Naive algorithm
 * Execution time: 1.25ms
 * Benchmark for HashTable algorithm
 * Execution time: 48.3µs
 * </pre>
 * A size marker opens a group. Each algorithm label must be followed, on the very next line, by a
 * {@code <label>: <number><unit>} line with unit {@code ns}, {@code µs}, {@code ms} or {@code s}. Any other line
 * outside a label/duration pair (headers, separators, blank lines) is ignored.
 */
public class BenchmarkAggregator
{
  private static final Logger LOG = LoggerFactory.getLogger(BenchmarkAggregator.class);

  public static final String SIZE_MARKER = "Benchmark for array size";
  public static final String ALGORITHM_MARKER = "Benchmark for";

  // plain decimal only: no sign, no hex, no trailing f/d
  private static final Pattern DECIMAL = Pattern.compile("([0-9]+(\\.[0-9]*)?|\\.[0-9]+)([eE][+-]?[0-9]+)?");

  private enum ScanState
  {
    AWAITING_SIZE,
    IN_GROUP,
    AWAITING_DURATION
  }

  private final DuplicatePolicy duplicatePolicy;

  public BenchmarkAggregator()
  {
    this(DuplicatePolicy.LAST_WRITE_WINS);
  }

  public BenchmarkAggregator(DuplicatePolicy duplicatePolicy)
  {
    this.duplicatePolicy = Preconditions.checkNotNull(duplicatePolicy, "duplicatePolicy");
  }

  public static double normalize(double duration, TimeUnitSuffix unit)
  {
    return unit.toMicros(duration);
  }

  /**
   * @throws MalformedRecordException at the first line that breaks the log format
   */
  public List<BenchmarkRecord> parse(Iterable<String> lines)
  {
    List<BenchmarkRecord> records = new ArrayList<>();
    ScanState state = ScanState.AWAITING_SIZE;
    long currentSize = -1;
    String pendingAlgorithm = null;
    int lineNumber = 0;
    String previousLine = null;

    for (String line : lines) {
      lineNumber++;
      if (state == ScanState.AWAITING_DURATION) {
        records.add(parseDuration(line, lineNumber, currentSize, pendingAlgorithm));
        pendingAlgorithm = null;
        state = ScanState.IN_GROUP;
      } else if (line.contains(SIZE_MARKER)) {
        currentSize = parseSize(line, lineNumber);
        state = ScanState.IN_GROUP;
      } else if (line.contains(ALGORITHM_MARKER)) {
        if (state == ScanState.AWAITING_SIZE) {
          throw new MalformedRecordException(lineNumber, line, "algorithm entry before any array size marker");
        }
        pendingAlgorithm = line.substring(line.lastIndexOf(ALGORITHM_MARKER) + ALGORITHM_MARKER.length()).trim();
        if (pendingAlgorithm.isEmpty()) {
          throw new MalformedRecordException(lineNumber, line, "missing algorithm name");
        }
        state = ScanState.AWAITING_DURATION;
      }
      previousLine = line;
    }

    if (state == ScanState.AWAITING_DURATION) {
      throw new MalformedRecordException(lineNumber, previousLine, "log ends before the duration of [" + pendingAlgorithm + "]");
    }
    LOG.debug("Parsed {} records from {} lines", records.size(), lineNumber);
    return records;
  }

  private static long parseSize(String line, int lineNumber)
  {
    String trimmed = line.trim();
    String token = trimmed.substring(trimmed.lastIndexOf(' ') + 1);
    final long size;
    try {
      size = Long.parseLong(token);
    }
    catch (NumberFormatException e) {
      throw new MalformedRecordException(lineNumber, line, "array size is not an integer", e);
    }
    if (size < 0) {
      throw new MalformedRecordException(lineNumber, line, "negative array size");
    }
    return size;
  }

  private static BenchmarkRecord parseDuration(String line, int lineNumber, long size, String algorithm)
  {
    int colon = line.lastIndexOf(':');
    if (colon < 0) {
      throw new MalformedRecordException(lineNumber, line, "expected '<label>: <duration>' after algorithm [" + algorithm + "]");
    }
    String token = line.substring(colon + 1).trim();
    TimeUnitSuffix unit = TimeUnitSuffix.matchSuffix(token).orElseThrow(
        () -> new MalformedRecordException(lineNumber, line, "unrecognized time unit in \"" + token + "\"")
    );

    String number = token.substring(0, token.length() - unit.symbol().length()).trim();
    if (!DECIMAL.matcher(number).matches()) {
      throw new MalformedRecordException(lineNumber, line, "duration \"" + number + "\" is not a decimal number");
    }
    final double duration = Double.parseDouble(number);
    if (!Double.isFinite(duration) || duration < 0) {
      throw new MalformedRecordException(lineNumber, line, "duration must be a finite non-negative number");
    }
    return new BenchmarkRecord(size, algorithm, duration, unit, lineNumber);
  }

  /**
   * Groups records by size, then algorithm. A repeated (size, algorithm) pair is settled by the
   * {@link DuplicatePolicy} this aggregator was built with.
   */
  public ResultTable toTable(Iterable<BenchmarkRecord> records)
  {
    Map<Long, Map<String, Double>> rows = new LinkedHashMap<>();
    int duplicates = 0;
    for (BenchmarkRecord record : records) {
      Map<String, Double> row = rows.computeIfAbsent(record.getInputSize(), size -> new LinkedHashMap<>());
      final double micros = record.toMicros();
      Double existing = row.get(record.getAlgorithm());
      if (existing == null) {
        row.put(record.getAlgorithm(), micros);
      } else {
        duplicates++;
        row.put(record.getAlgorithm(), duplicatePolicy.resolve(record, existing, micros));
      }
    }
    if (duplicates > 0) {
      LOG.info("{} duplicate timings resolved with {}", duplicates, duplicatePolicy);
    }
    return new ResultTable(rows, duplicates);
  }

  public ResultTable parseStream(Iterable<String> lines)
  {
    return toTable(parse(lines));
  }
}
