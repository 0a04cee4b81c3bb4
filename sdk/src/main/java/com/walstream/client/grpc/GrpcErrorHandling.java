package com.walstream.client.grpc;

import io.grpc.Status;

/** Utility for describing gRPC failures in log lines and exception messages. */
public class GrpcErrorHandling {

  private GrpcErrorHandling() {}

  /**
   * Returns a one-line description of a failure, {@code CODE: description} for gRPC errors.
   *
   * @param t the failure
   * @return the description
   */
  public static String describe(Throwable t) {
    Status status = Status.fromThrowable(t);
    if (status.getCode() == Status.Code.UNKNOWN && status.getDescription() == null) {
      return t.getClass().getSimpleName() + ": " + t.getMessage();
    }
    return status.getDescription() == null
        ? status.getCode().name()
        : status.getCode() + ": " + status.getDescription();
  }
}
