package com.increase.request;

import java.math.BigInteger;
import java.util.Map;

/**
 * The logical limit of a paginated call: the maximum number of items returned across all pages,
 * as opposed to the server's page size.
 */
public sealed interface Limit permits Limit.Unbounded, Limit.All, Limit.Bounded {

  String KEY = "limit";
  String ALL_MARKER = "all";

  /** Largest limit the API accepts as a page size. */
  int MAX_PAGE_SIZE = 100;

  /** No limit given: a single page is fetched. */
  record Unbounded() implements Limit {}

  /** Every page is fetched. */
  record All() implements Limit {}

  record Bounded(long value) implements Limit {
    public Bounded {
      if (value < 0) {
        throw new IllegalArgumentException("limit must not be negative, got " + value);
      }
    }
  }

  static Limit unbounded() {
    return new Unbounded();
  }

  static Limit all() {
    return new All();
  }

  static Limit of(long value) {
    return new Bounded(value);
  }

  /**
   * Parses the {@code limit} entry of request params. Accepts nothing, the marker {@code "all"},
   * a {@link Limit}, or an integral number. Anything else is rejected rather than coerced.
   *
   * @throws IllegalArgumentException for values of any other shape
   */
  static Limit from(Map<String, ?> params) {
    Object raw = params == null ? null : params.get(KEY);
    if (raw == null) {
      return unbounded();
    }
    if (raw instanceof Limit limit) {
      return limit;
    }
    if (raw instanceof CharSequence text && ALL_MARKER.equalsIgnoreCase(text.toString())) {
      return all();
    }
    if (raw instanceof Integer || raw instanceof Long || raw instanceof Short
        || raw instanceof Byte) {
      return of(((Number) raw).longValue());
    }
    if (raw instanceof BigInteger big) {
      try {
        return of(big.longValueExact());
      } catch (ArithmeticException e) {
        throw new IllegalArgumentException("limit is out of range: " + big, e);
      }
    }
    throw new IllegalArgumentException(
        "limit must be an integer or \"" + ALL_MARKER + "\", got " + raw.getClass().getSimpleName()
            + " " + raw);
  }

  /** Whether the {@code limit} key is dropped from outgoing params, leaving page size to the server. */
  default boolean stripsFromRequest() {
    return this instanceof All || (this instanceof Bounded b && b.value() > MAX_PAGE_SIZE);
  }
}
