package com.increase.request;

import com.increase.exception.IncreaseResponseException;
import com.increase.response.ResponseHash;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;

/**
 * Follows {@code next_cursor} from page to page until the logical limit is reached or the server
 * runs out of pages.
 *
 * <p>The {@code limit} param decides how far to go:
 * <ul>
 *   <li>absent: one page, even if the server returns a cursor</li>
 *   <li>{@code "all"}: every page; {@code limit} is not sent</li>
 *   <li>{@code n}: pages until {@code n} items were seen, the last page trimmed so that exactly
 *       {@code n} items are returned; {@code limit} is sent as page size unless {@code n > 100}</li>
 * </ul>
 *
 * <p>Pages are fetched sequentially on the calling thread.
 */
@Slf4j
@RequiredArgsConstructor
public class Paginator {

  private final RequestExecutor executor;

  /**
   * Fetches pages and returns their items in order.
   *
   * @throws IncreaseResponseException if a response has no {@code data} array
   */
  public List<ResponseHash> collect(
      HttpMethod method, String path, Map<String, ?> params, Map<String, String> headers) {
    List<ResponseHash> results = new ArrayList<>();
    run(
        method,
        path,
        params,
        headers,
        new PageHandler() {
          @Override
          public void onPage(List<ResponseHash> items) {
            results.addAll(items);
          }

          @Override
          public void onRawResponse(ResponseHash response) {
            throw new IncreaseResponseException(
                "Response to " + method + " " + path + " has no data field",
                response.response() == null ? 0 : response.response().status(),
                response.toString());
          }
        });
    return Collections.unmodifiableList(results);
  }

  /**
   * Fetches pages and hands each one to {@code handler} as soon as it arrives.
   *
   * <p>If the first response has no {@code data} array the endpoint does not paginate: the whole
   * response goes to {@link PageHandler#onRawResponse} and is also returned.
   *
   * @return the raw response in the non-paginating case, otherwise empty
   */
  public Optional<ResponseHash> forEachPage(
      HttpMethod method,
      String path,
      Map<String, ?> params,
      Map<String, String> headers,
      PageHandler handler) {
    if (handler == null) {
      throw new IllegalArgumentException("handler must not be null");
    }
    return run(method, path, params, headers, handler);
  }

  private Optional<ResponseHash> run(
      HttpMethod method,
      String path,
      Map<String, ?> params,
      Map<String, String> headers,
      PageHandler sink) {
    PageRequestState state = new PageRequestState(params);
    log.debug("Paginating {} {} with limit {}", method, path, state.getLimit());

    while (true) {
      ResponseHash res = executor.execute(method, path, state.getParams(), headers);

      Optional<List<ResponseHash>> page = res.data();
      if (page.isEmpty()) {
        log.debug("{} {} returned no data field, handing over the raw response", method, path);
        sink.onRawResponse(res);
        return Optional.of(res);
      }

      List<ResponseHash> data = page.get();
      int keep = state.accept(data.size());
      sink.onPage(keep == data.size() ? data : data.subList(0, keep));

      String cursor = res.nextCursor().orElse(null);
      log.debug(
          "Fetched page of {} from {}, {} seen, more pages: {}",
          data.size(), path, state.getCount(), cursor != null);
      if (state.isFinished(cursor)) {
        log.info("Pagination of {} {} finished with {} items", method, path, state.getDelivered());
        return Optional.empty();
      }
      state.advance(cursor);
    }
  }
}
