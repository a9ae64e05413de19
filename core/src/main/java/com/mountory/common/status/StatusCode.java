package com.mountory.common.status;

/**
 * Status codes returned by the data-access layer. The names follow the gRPC canonical codes so
 * that a transport layer in front of this library can map them one-to-one.
 */
public enum StatusCode {
  OK,
  /** A required field was missing or cleared, or a paging argument was negative. */
  INVALID_ARGUMENT,
  NOT_FOUND,
  /** The store reported an error; the original exception is kept as the status cause. */
  INTERNAL;

  /** Returns whether this status code represents an error. */
  public boolean isError() {
    return this != OK;
  }
}
