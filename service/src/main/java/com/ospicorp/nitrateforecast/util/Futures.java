package com.ospicorp.nitrateforecast.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

public final class Futures {
  private Futures() {
  }

  /** Joins and rethrows the task's own unchecked exception instead of the completion wrapper. */
  public static <T> T await(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw ex;
    }
  }
}
