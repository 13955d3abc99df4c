package com.paysync.model;

import jakarta.persistence.CascadeType;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.MapKeyColumn;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "ledger_entries",
    uniqueConstraints = @UniqueConstraint(columnNames = {"account_id", "provider", "external_id"}))
@Getter
@Setter
public class LedgerEntry {
  private static final int DEFAULT_VARCHAR_LIMIT = 255;

  @Id
  private UUID id;

  @ManyToOne(optional = false)
  @JoinColumn(name = "account_id")
  private Account account;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private ProviderType provider;

  @Column(name = "external_id", nullable = false, length = 128)
  private String externalId;

  @Column(nullable = false)
  private Instant paidAt;

  @Column(length = 512)
  private String merchantName;

  @Column(length = 64)
  private String merchantTel;

  @Column(length = 1024)
  private String merchantUrl;

  @Column(length = 1024)
  private String merchantImageUrl;

  @Column(length = 64)
  private String statusCode;

  @Column
  private String statusText;

  @Column(length = 32)
  private String statusColor;

  @Column(columnDefinition = "text")
  private String productName;

  @Column
  private Integer productCount;

  @Column(length = 1024)
  private String productDetailUrl;

  @Column(length = 1024)
  private String orderDetailUrl;

  @Column(nullable = false)
  private long totalAmount;

  @Column
  private Long discountAmount;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "ledger_entry_amounts", joinColumns = @JoinColumn(name = "entry_id"))
  @MapKeyColumn(name = "amount_key", length = 64)
  @Column(name = "amount_value")
  private Map<String, Long> amountDetails = new LinkedHashMap<>();

  @OneToMany(mappedBy = "entry", cascade = CascadeType.ALL, orphanRemoval = true)
  @OrderBy("lineNo ASC")
  private List<LedgerLineItem> items = new ArrayList<>();

  @Column(nullable = false)
  private Instant createdAt;

  @Column
  private Instant updatedAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    Instant now = Instant.now();
    if (createdAt == null) {
      createdAt = now;
    }
    updatedAt = now;
    normalizeLengths();
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
    normalizeLengths();
  }

  private void normalizeLengths() {
    statusText = truncate(statusText, DEFAULT_VARCHAR_LIMIT);
  }

  private static String truncate(String value, int max) {
    if (value == null || value.length() <= max) {
      return value;
    }
    return value.substring(0, max);
  }
}
