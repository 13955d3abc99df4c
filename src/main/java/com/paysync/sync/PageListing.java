package com.paysync.sync;

import java.util.List;

/** Stubs of one page in provider order, plus the provider's page count when it reports one. */
public record PageListing(List<ListingStub> stubs, Integer reportedTotalPages) {
  public PageListing {
    stubs = stubs == null ? List.of() : List.copyOf(stubs);
  }

  public static PageListing of(List<ListingStub> stubs) {
    return new PageListing(stubs, null);
  }

  public boolean isEmpty() {
    return stubs.isEmpty();
  }
}
