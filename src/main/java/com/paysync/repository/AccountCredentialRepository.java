package com.paysync.repository;

import com.paysync.model.AccountCredential;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AccountCredentialRepository extends JpaRepository<AccountCredential, UUID> {
  List<AccountCredential> findByAccountId(UUID accountId);

  void deleteByAccountId(UUID accountId);
}
