package com.spot.dataset.sql;

public class SqlDatasetException extends RuntimeException {
  public SqlDatasetException(String msg) {
    super(msg);
  }

  public SqlDatasetException(String msg, Throwable t) {
    super(msg, t);
  }

  public SqlDatasetException(Throwable t) {
    super(t);
  }
}
