package com.paysync.repository;

import com.paysync.model.Account;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AccountRepository extends JpaRepository<Account, UUID> {
  List<Account> findByAutoSyncEnabledTrue();
}
