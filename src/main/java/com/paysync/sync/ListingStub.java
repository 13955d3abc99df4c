package com.paysync.sync;

/**
 * Listing-page entry identifying a record without its detail. Status and
 * deep-link fields come from the listing and override the detail payload.
 */
public record ListingStub(
    String externalId,
    String subType,
    String secondaryId,
    String statusCode,
    String statusText,
    String statusColor,
    String productDetailUrl,
    String orderDetailUrl
) {
  public static ListingStub of(String externalId) {
    return new ListingStub(externalId, null, null, null, null, null, null, null);
  }
}
