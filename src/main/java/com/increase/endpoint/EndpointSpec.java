package com.increase.endpoint;

import com.increase.exception.EndpointDefinitionException;
import java.util.List;
import lombok.Builder;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpMethod;

/**
 * Immutable description of one operation of a resource type.
 *
 * <p>{@code urlSegments} holds at most two literal segments. With two segments the path is
 * {@code root/segment0/{id}/segment1}, which only makes sense when an id is required; any other
 * shape is rejected here, at definition time.
 */
@Builder
public record EndpointSpec(
    String operationName,
    HttpMethod httpMethod,
    List<String> urlSegments,
    boolean requiresId,
    boolean paginated
) {

  public static final int MAX_SEGMENTS = 2;

  public EndpointSpec {
    if (StringUtils.isBlank(operationName)) {
      throw new EndpointDefinitionException("Endpoint operation name must not be blank");
    }
    if (httpMethod == null) {
      throw new EndpointDefinitionException(
          "Endpoint " + operationName + " must declare an HTTP method");
    }
    urlSegments = urlSegments == null ? List.of() : List.copyOf(urlSegments);
    if (urlSegments.size() > MAX_SEGMENTS) {
      throw new EndpointDefinitionException(
          "Invalid URL shape for " + operationName + ": max of " + MAX_SEGMENTS
              + " segments allowed, got " + urlSegments);
    }
    if (urlSegments.size() == MAX_SEGMENTS && !requiresId) {
      throw new EndpointDefinitionException(
          "Invalid URL shape for " + operationName
              + ": only one segment allowed when the endpoint does not take an id");
    }
    for (String segment : urlSegments) {
      if (StringUtils.isBlank(segment) || segment.contains("/")) {
        throw new EndpointDefinitionException(
            "Invalid URL segment '" + segment + "' for " + operationName);
      }
    }
  }
}
