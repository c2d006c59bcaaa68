/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.tsforecast.timeseries;

import com.google.common.base.Preconditions;
import java.io.Serializable;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.apache.commons.lang3.ArrayUtils;

/**
 * An immutable, gap-free monthly series.
 *
 * <p>The series is indexed by consecutive calendar months starting at {@link #start()}. Every
 * derived series (slices, splits, joins) is a new instance; the backing array is never shared
 * with callers.
 */
public final class TimeSeries implements Serializable {
  private static final long serialVersionUID = 1;

  /** Monthly data with a yearly cycle. */
  public static final int MONTHLY = 12;

  private final YearMonth start;
  private final double[] values;
  private final int seasonalPeriod;

  private TimeSeries(YearMonth start, double[] values, int seasonalPeriod) {
    this.start = start;
    this.values = values;
    this.seasonalPeriod = seasonalPeriod;
  }

  /** Builds a series with yearly seasonality from aligned periods and values. */
  public static TimeSeries fromPairs(List<YearMonth> periods, double[] values) {
    return fromPairs(periods, values, MONTHLY);
  }

  /**
   * Builds a series from aligned periods and values.
   *
   * @throws MalformedSeriesException if the lengths differ, the series is empty, the periods do
   *     not advance by exactly one month, or a value is not finite
   */
  public static TimeSeries fromPairs(List<YearMonth> periods, double[] values, int seasonalPeriod) {
    Preconditions.checkNotNull(periods, "periods");
    Preconditions.checkNotNull(values, "values");
    if (periods.size() != values.length) {
      throw new MalformedSeriesException(String.format(
          "Got %d periods but %d values", periods.size(), values.length));
    }
    if (periods.isEmpty()) {
      throw new MalformedSeriesException("A series needs at least one period");
    }
    for (int i = 1; i < periods.size(); i++) {
      YearMonth previous = periods.get(i - 1);
      YearMonth current = periods.get(i);
      if (previous == null || current == null || !previous.plusMonths(1).equals(current)) {
        throw new MalformedSeriesException(String.format(
            "Period %s at index %d does not follow %s", current, i, previous));
      }
    }
    if (periods.get(0) == null) {
      throw new MalformedSeriesException("Period at index 0 is null");
    }
    return of(periods.get(0), values, seasonalPeriod);
  }

  /** Builds a series with yearly seasonality from a first month and consecutive values. */
  public static TimeSeries of(YearMonth start, double... values) {
    return of(start, values, MONTHLY);
  }

  /**
   * Builds a series from a first month and consecutive values.
   *
   * @throws MalformedSeriesException if the series is empty or a value is not finite
   */
  public static TimeSeries of(YearMonth start, double[] values, int seasonalPeriod) {
    Preconditions.checkNotNull(start, "start");
    Preconditions.checkArgument(seasonalPeriod >= 1, "Seasonal period must be positive");
    if (values.length == 0) {
      throw new MalformedSeriesException("A series needs at least one period");
    }
    for (int i = 0; i < values.length; i++) {
      if (Double.isNaN(values[i]) || Double.isInfinite(values[i])) {
        throw new MalformedSeriesException(String.format(
            "Value %s at %s is not finite", values[i], start.plusMonths(i)));
      }
    }
    return new TimeSeries(start, values.clone(), seasonalPeriod);
  }

  public YearMonth start() {
    return start;
  }

  public YearMonth end() {
    return start.plusMonths(values.length - 1);
  }

  public int size() {
    return values.length;
  }

  public int seasonalPeriod() {
    return seasonalPeriod;
  }

  /** Number of complete seasonal cycles. */
  public int cycles() {
    return values.length / seasonalPeriod;
  }

  /** Position of the observation at index within its seasonal cycle, counted from the start. */
  public int positionInCycle(int index) {
    return index % seasonalPeriod;
  }

  public double get(int index) {
    return values[index];
  }

  public double first() {
    return values[0];
  }

  public double last() {
    return values[values.length - 1];
  }

  /** A copy of the values. */
  public double[] values() {
    return values.clone();
  }

  public YearMonth periodAt(int index) {
    Preconditions.checkElementIndex(index, values.length);
    return start.plusMonths(index);
  }

  public List<YearMonth> periods() {
    List<YearMonth> periods = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      periods.add(start.plusMonths(i));
    }
    return Collections.unmodifiableList(periods);
  }

  /** Index of the period, or -1 when the series does not cover it. */
  public int indexOf(YearMonth period) {
    long offset = ChronoUnit.MONTHS.between(start, period);
    return offset < 0 || offset >= values.length ? -1 : (int) offset;
  }

  public boolean contains(YearMonth period) {
    return indexOf(period) >= 0;
  }

  /**
   * The contiguous sub-series between from and to, both inclusive.
   *
   * @throws PeriodOutOfRangeException if a bound lies outside the series or from is after to
   */
  public TimeSeries slice(YearMonth from, YearMonth to) {
    int fromIndex = indexOf(from);
    int toIndex = indexOf(to);
    if (fromIndex < 0 || toIndex < 0) {
      throw new PeriodOutOfRangeException(String.format(
          "Slice [%s, %s] is outside the series [%s, %s]", from, to, start, end()));
    }
    if (fromIndex > toIndex) {
      throw new PeriodOutOfRangeException(String.format(
          "Slice start %s is after slice end %s", from, to));
    }
    return new TimeSeries(from, ArrayUtils.subarray(values, fromIndex, toIndex + 1),
        seasonalPeriod);
  }

  /**
   * Splits into the periods strictly before cutoff and the remaining periods.
   *
   * @throws EmptySplitException if either side would be empty
   */
  public Split split(YearMonth cutoff) {
    long offset = ChronoUnit.MONTHS.between(start, cutoff);
    if (offset <= 0 || offset >= values.length) {
      throw new EmptySplitException(String.format(
          "Cutoff %s leaves an empty side of the series [%s, %s]", cutoff, start, end()));
    }
    int index = (int) offset;
    return new Split(
        new TimeSeries(start, ArrayUtils.subarray(values, 0, index), seasonalPeriod),
        new TimeSeries(cutoff, ArrayUtils.subarray(values, index, values.length),
            seasonalPeriod));
  }

  /** The first count observations. */
  public TimeSeries head(int count) {
    Preconditions.checkArgument(count >= 1 && count <= values.length,
        "Cannot take %s of %s observations", count, values.length);
    return new TimeSeries(start, ArrayUtils.subarray(values, 0, count), seasonalPeriod);
  }

  /** The last count observations. */
  public TimeSeries tail(int count) {
    Preconditions.checkArgument(count >= 1 && count <= values.length,
        "Cannot take %s of %s observations", count, values.length);
    int from = values.length - count;
    return new TimeSeries(start.plusMonths(from),
        ArrayUtils.subarray(values, from, values.length), seasonalPeriod);
  }

  /**
   * Joins a series that starts on the month after this one ends.
   *
   * @throws MalformedSeriesException on a gap, an overlap or a different seasonal period
   */
  public TimeSeries append(TimeSeries next) {
    if (!end().plusMonths(1).equals(next.start)) {
      throw new MalformedSeriesException(String.format(
          "Cannot join series ending %s with series starting %s", end(), next.start));
    }
    if (next.seasonalPeriod != seasonalPeriod) {
      throw new MalformedSeriesException(String.format(
          "Cannot join seasonal periods %d and %d", seasonalPeriod, next.seasonalPeriod));
    }
    return new TimeSeries(start, ArrayUtils.addAll(values, next.values), seasonalPeriod);
  }

  /** A series over the same periods with different values. */
  public TimeSeries withValues(double[] newValues) {
    Preconditions.checkArgument(newValues.length == values.length,
        "Expected %s values, got %s", values.length, newValues.length);
    return of(start, newValues, seasonalPeriod);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof TimeSeries)) {
      return false;
    }
    TimeSeries other = (TimeSeries) obj;
    return start.equals(other.start)
        && seasonalPeriod == other.seasonalPeriod
        && Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, seasonalPeriod, Arrays.hashCode(values));
  }

  @Override
  public String toString() {
    return String.format("TimeSeries[%s..%s, n=%d, period=%d]",
        start, end(), values.length, seasonalPeriod);
  }

  /** The two halves of {@link #split}. */
  public static final class Split implements Serializable {
    private static final long serialVersionUID = 1;

    private final TimeSeries train;
    private final TimeSeries test;

    Split(TimeSeries train, TimeSeries test) {
      this.train = train;
      this.test = test;
    }

    public TimeSeries train() {
      return train;
    }

    public TimeSeries test() {
      return test;
    }
  }
}
