package com.spot.filter;

/** Notified whenever {@link Filter#getData()} has been replaced. Read the data from the filter. */
@FunctionalInterface
public interface FilterListener {
  void onNewData();
}
