package com.paysync.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "ledger_line_items")
@Getter
@Setter
public class LedgerLineItem {
  @Id
  private UUID id;

  @ManyToOne(optional = false)
  @JoinColumn(name = "entry_id")
  private LedgerEntry entry;

  @Column(name = "line_no", nullable = false)
  private int lineNo;

  @Column(length = 128)
  private String productId;

  @Column(columnDefinition = "text", nullable = false)
  private String productName;

  @Column(nullable = false)
  private int quantity;

  @Column
  private Long unitPrice;

  @Column
  private Long lineAmount;

  @Column(length = 1024)
  private String imageUrl;

  @Column(length = 1024)
  private String infoUrl;

  @Column
  private String brandName;

  @Column(columnDefinition = "text")
  private String memo;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
  }
}
