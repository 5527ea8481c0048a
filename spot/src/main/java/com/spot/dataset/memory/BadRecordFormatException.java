package com.spot.dataset.memory;

public class BadRecordFormatException extends RuntimeException {
  public BadRecordFormatException(String msg) {
    super(msg);
  }

  public BadRecordFormatException(String msg, Throwable t) {
    super(msg, t);
  }

  public BadRecordFormatException(Throwable t) {
    super(t);
  }
}
