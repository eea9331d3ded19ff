package com.increase.request;

import com.increase.response.ResponseHash;
import java.util.List;

/**
 * Receives the results of a paginated call one page at a time.
 */
@FunctionalInterface
public interface PageHandler {

  /** Called once per fetched page, already trimmed to the logical limit. */
  void onPage(List<ResponseHash> items);

  /**
   * Called instead of {@link #onPage} when the endpoint turned out not to paginate (the response
   * has no {@code data} array). Receives the whole response; by default as a one-item page.
   */
  default void onRawResponse(ResponseHash response) {
    onPage(List.of(response));
  }
}
