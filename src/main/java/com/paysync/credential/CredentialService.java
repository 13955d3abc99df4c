package com.paysync.credential;

import com.paysync.model.Account;
import com.paysync.model.AccountCredential;
import com.paysync.repository.AccountCredentialRepository;
import com.paysync.repository.AccountRepository;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
public class CredentialService implements HeaderSupplier {
  // Hop-by-hop headers captured with a browser request that must not be replayed.
  private static final Set<String> IGNORED_HEADERS = Set.of("content-length", "host", "connection");

  private final AccountRepository accountRepository;
  private final AccountCredentialRepository credentialRepository;
  private final HeaderCipher headerCipher;

  public CredentialService(AccountRepository accountRepository,
                           AccountCredentialRepository credentialRepository,
                           HeaderCipher headerCipher) {
    this.accountRepository = accountRepository;
    this.credentialRepository = credentialRepository;
    this.headerCipher = headerCipher;
  }

  @Override
  @Transactional(readOnly = true)
  public Map<String, String> getHeaders(UUID accountId) {
    Map<String, String> headers = new LinkedHashMap<>();
    for (AccountCredential credential : credentialRepository.findByAccountId(accountId)) {
      String name = credential.getHeaderName();
      headers.put(name, headerCipher.open(accountId, name, credential.getEncryptedValue()));
    }
    return headers;
  }

  @Transactional
  public int replaceCredentials(UUID accountId, Map<String, String> headers) {
    Account account = accountRepository.findById(accountId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Account not found"));
    credentialRepository.deleteByAccountId(accountId);
    credentialRepository.flush();
    if (headers == null) {
      return 0;
    }
    int stored = 0;
    for (Map.Entry<String, String> header : headers.entrySet()) {
      String name = header.getKey() == null ? null : header.getKey().trim();
      if (name == null || name.isEmpty() || header.getValue() == null) {
        continue;
      }
      if (IGNORED_HEADERS.contains(name.toLowerCase())) {
        continue;
      }
      AccountCredential credential = new AccountCredential();
      credential.setAccount(account);
      credential.setHeaderName(name);
      credential.setEncryptedValue(headerCipher.seal(accountId, name, header.getValue()));
      credentialRepository.save(credential);
      stored++;
    }
    return stored;
  }
}
