package com.paysync.ledger;

import com.paysync.model.Account;
import com.paysync.model.LedgerEntry;
import com.paysync.model.LedgerLineItem;
import com.paysync.model.ProviderType;
import com.paysync.repository.AccountRepository;
import com.paysync.repository.LedgerEntryRepository;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaLedgerGateway implements LedgerGateway {
  private static final Logger log = LoggerFactory.getLogger(JpaLedgerGateway.class);

  private final LedgerEntryRepository entryRepository;
  private final AccountRepository accountRepository;

  public JpaLedgerGateway(LedgerEntryRepository entryRepository, AccountRepository accountRepository) {
    this.entryRepository = entryRepository;
    this.accountRepository = accountRepository;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Checkpoint> getCheckpoint(UUID accountId, ProviderType provider) {
    return entryRepository.findFirstByAccountIdAndProviderOrderByPaidAtDesc(accountId, provider)
        .map(entry -> new Checkpoint(entry.getExternalId(), entry.getPaidAt()));
  }

  @Override
  @Transactional
  public void save(UUID accountId, TransactionRecord record) {
    if (record.externalId() == null || record.externalId().isBlank()) {
      throw new IllegalArgumentException("Record without external id cannot be stored");
    }
    LedgerEntry entry = entryRepository
        .findByAccountIdAndProviderAndExternalId(accountId, record.providerType(), record.externalId())
        .orElseGet(LedgerEntry::new);
    if (entry.getId() == null) {
      Account account = accountRepository.findById(accountId)
          .orElseThrow(() -> new IllegalStateException("Unknown account " + accountId));
      entry.setAccount(account);
      entry.setProvider(record.providerType());
      entry.setExternalId(record.externalId());
    }
    entry.setPaidAt(record.paidAt());
    if (record.merchant() != null) {
      entry.setMerchantName(record.merchant().name());
      entry.setMerchantTel(record.merchant().tel());
      entry.setMerchantUrl(record.merchant().url());
      entry.setMerchantImageUrl(record.merchant().imageUrl());
    }
    entry.setStatusCode(record.statusCode());
    entry.setStatusText(record.statusText());
    entry.setStatusColor(record.statusColor());
    entry.setProductName(record.productName());
    entry.setProductCount(record.productCount());
    entry.setProductDetailUrl(record.productDetailUrl());
    entry.setOrderDetailUrl(record.orderDetailUrl());
    entry.setTotalAmount(record.totalAmount());
    entry.setDiscountAmount(record.discountAmount());
    entry.getAmountDetails().clear();
    entry.getAmountDetails().putAll(record.amountDetails());

    entry.getItems().clear();
    for (LineItem item : record.lineItems()) {
      LedgerLineItem row = new LedgerLineItem();
      row.setEntry(entry);
      row.setLineNo(item.lineNo());
      row.setProductId(item.productId());
      row.setProductName(item.productName());
      row.setQuantity(item.quantity());
      row.setUnitPrice(item.unitPrice());
      row.setLineAmount(item.lineAmount());
      row.setImageUrl(item.imageUrl());
      row.setInfoUrl(item.infoUrl());
      row.setBrandName(item.brandName());
      row.setMemo(item.memo());
      entry.getItems().add(row);
    }
    entryRepository.save(entry);
  }

  @Override
  @Transactional
  public long truncate(UUID accountId, ProviderType provider) {
    long removed = entryRepository.deleteByAccountIdAndProvider(accountId, provider);
    log.info("Cleared {} {} ledger entries for account {}", removed, provider, accountId);
    return removed;
  }
}
