package com.increase.resource;

import com.increase.endpoint.EndpointSpec;
import com.increase.endpoint.UrlBuilder;
import com.increase.exception.EndpointDefinitionException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;

/**
 * Declares the operations of one resource type. Used once, from the resource's static
 * initialiser:
 *
 * <pre>{@code
 * public static final EndpointRegistry ENDPOINTS =
 *     EndpointRegistrar.forResource(Accounts.class)
 *         .create()
 *         .list()
 *         .retrieve()
 *         .endpoint("close", HttpMethod.POST, EndpointOption.ID)
 *         .register();
 * }</pre>
 *
 * Invalid shapes fail with {@link EndpointDefinitionException} while the class loads.
 */
@Slf4j
public final class EndpointRegistrar {

  public static final String CREATE = "create";
  public static final String LIST = "list";
  public static final String UPDATE = "update";
  public static final String RETRIEVE = "retrieve";

  private final String resourceName;
  private final Map<String, EndpointSpec> specs = new LinkedHashMap<>();
  private boolean registered;

  private EndpointRegistrar(String resourceName) {
    this.resourceName = resourceName;
  }

  public static EndpointRegistrar forResource(Class<? extends Resource> resourceType) {
    return new EndpointRegistrar(UrlBuilder.resourceName(resourceType));
  }

  /**
   * @param resourceName words naming the resource, e.g. {@code Digital Wallet Tokens}
   */
  public static EndpointRegistrar forResourceName(String resourceName) {
    if (resourceName == null || resourceName.isBlank()) {
      throw new EndpointDefinitionException("Resource name must not be blank");
    }
    return new EndpointRegistrar(resourceName.trim());
  }

  /**
   * Declares an operation whose single path segment is its own name, e.g. {@code close} on
   * {@code /accounts/{id}/close}.
   */
  public EndpointRegistrar endpoint(String name, HttpMethod method, EndpointOption... with) {
    return endpoint(name, method, List.of(name == null ? "" : name), with);
  }

  /**
   * Declares an operation with an explicit URL shape.
   *
   * @param to path segments after the resource root; empty for the root itself. With two
   *     segments the id goes between them
   */
  public EndpointRegistrar endpoint(
      String name, HttpMethod method, List<String> to, EndpointOption... with) {
    ensureOpen();
    Set<EndpointOption> options = Set.copyOf(Arrays.asList(with));
    EndpointSpec spec = EndpointSpec.builder()
        .operationName(name)
        .httpMethod(method)
        .urlSegments(to)
        .requiresId(options.contains(EndpointOption.ID))
        .paginated(options.contains(EndpointOption.PAGINATION))
        .build();
    if (specs.putIfAbsent(spec.operationName(), spec) != null) {
      throw new EndpointDefinitionException(
          "Endpoint " + spec.operationName() + " is already defined on " + resourceName);
    }
    log.debug("Registered {}.{}: {} {}", resourceName, name, method, spec.urlSegments());
    return this;
  }

  /** POST to the resource root. */
  public EndpointRegistrar create() {
    return endpoint(CREATE, HttpMethod.POST, List.of());
  }

  /** Paginated GET on the resource root. */
  public EndpointRegistrar list() {
    return endpoint(LIST, HttpMethod.GET, List.of(), EndpointOption.PAGINATION);
  }

  /** PATCH on {@code root/{id}}. */
  public EndpointRegistrar update() {
    return endpoint(UPDATE, HttpMethod.PATCH, List.of(), EndpointOption.ID);
  }

  /** GET on {@code root/{id}}. */
  public EndpointRegistrar retrieve() {
    return endpoint(RETRIEVE, HttpMethod.GET, List.of(), EndpointOption.ID);
  }

  /**
   * Freezes the declarations. The registrar cannot be used afterwards.
   */
  public EndpointRegistry register() {
    ensureOpen();
    registered = true;
    return new EndpointRegistry(resourceName, UrlBuilder.resourceRoot(resourceName), specs);
  }

  private void ensureOpen() {
    if (registered) {
      throw new IllegalStateException("Endpoints of " + resourceName + " are already registered");
    }
  }
}
