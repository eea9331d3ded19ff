package com.increase.resource;

/**
 * Modifiers of an endpoint declaration.
 */
public enum EndpointOption {
  /** The operation targets one resource; its id is part of the path. */
  ID,
  /** The response is a page of {@code data} plus a {@code next_cursor}. */
  PAGINATION
}
