package com.increase.request;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Mutable state of one pagination run. Outgoing params are replaced, never modified, so the map
 * handed in by the caller and maps already passed to the transport stay untouched.
 */
@Getter
final class PageRequestState {

  private final Limit limit;
  private Map<String, Object> params;
  private long count;
  private long delivered;

  PageRequestState(Map<String, ?> callerParams) {
    this.limit = Limit.from(callerParams);
    Map<String, Object> initial = new LinkedHashMap<>();
    if (callerParams != null) {
      initial.putAll(callerParams);
    }
    if (limit.stripsFromRequest() || limit instanceof Limit.Unbounded) {
      initial.remove(Limit.KEY);
    } else if (initial.get(Limit.KEY) instanceof Limit.Bounded bounded) {
      initial.put(Limit.KEY, bounded.value());
    }
    this.params = Collections.unmodifiableMap(initial);
  }

  /**
   * Counts a fetched page and returns how many of its items fit under the limit.
   */
  int accept(int pageSize) {
    long before = count;
    count += pageSize;
    int keep = pageSize;
    if (limit instanceof Limit.Bounded bounded && count >= bounded.value()) {
      keep = (int) Math.max(0, Math.min(pageSize, bounded.value() - before));
    }
    delivered += keep;
    return keep;
  }

  boolean isFinished(String cursor) {
    if (limit instanceof Limit.Unbounded) {
      return true;
    }
    if (limit instanceof Limit.Bounded bounded && count >= bounded.value()) {
      return true;
    }
    return cursor == null;
  }

  void advance(String cursor) {
    Map<String, Object> next = new LinkedHashMap<>(params);
    next.put("cursor", cursor);
    this.params = Collections.unmodifiableMap(next);
  }
}
