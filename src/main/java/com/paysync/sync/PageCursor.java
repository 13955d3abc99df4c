package com.paysync.sync;

/**
 * Position of a listing request. {@code year} is null for providers without
 * year partitions; {@code sequence} counts pages across the whole run.
 */
public record PageCursor(Integer year, int pageIndex, int sequence) {
  public String describe() {
    return year == null
        ? "page " + pageIndex
        : year + " pageIndex=" + pageIndex;
  }
}
