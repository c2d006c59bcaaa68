package net.larse.tsforecast.helper;

/** Static array manipulation functions. */
public class ArrayHelper {
  /**
   * Mean of array between start (incl) and end (excl). if end is negative, it is taken as the
   * number of entries from the end (ie: -1 = len-1).
   */
  public static double mean(double[] array, int start, int end) {
    if (end < 0) {
      end = array.length + end;
    }
    if (end <= start) {
      return Double.NaN;
    }
    double sum = 0;
    for (int i = start; i < end; i++) {
      sum += array[i];
    }
    return sum / (end - start);
  }

  /** Sum of squares of array between start (incl) and end (excl). */
  public static double sumOfSquares(double[] array, int start, int end) {
    if (end < 0) {
      end = array.length + end;
    }
    double sum = 0;
    for (int i = start; i < end; i++) {
      sum += array[i] * array[i];
    }
    return sum;
  }

  /** Element-wise a - b. */
  public static double[] subtract(double[] a, double[] b) {
    double[] result = new double[a.length];
    for (int i = 0; i < a.length; i++) {
      result[i] = a[i] - b[i];
    }
    return result;
  }

  /** Smallest odd integer that is not smaller than value. */
  public static int nextOdd(double value) {
    int n = (int) Math.ceil(value);
    return n % 2 == 0 ? n + 1 : n;
  }
}
