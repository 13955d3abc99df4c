package com.paysync.controller;

import com.paysync.credential.CredentialService;
import com.paysync.dto.AccountResponse;
import com.paysync.dto.CreateAccountRequest;
import com.paysync.dto.CredentialsResponse;
import com.paysync.dto.ReplaceCredentialsRequest;
import com.paysync.dto.UpdateAccountRequest;
import com.paysync.ledger.Checkpoint;
import com.paysync.service.AccountService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/accounts")
public class AccountController {
  private final AccountService accountService;
  private final CredentialService credentialService;

  public AccountController(AccountService accountService, CredentialService credentialService) {
    this.accountService = accountService;
    this.credentialService = credentialService;
  }

  @GetMapping
  public List<AccountResponse> listAccounts() {
    return accountService.listAccounts();
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public AccountResponse createAccount(@Valid @RequestBody CreateAccountRequest request) {
    return accountService.createAccount(request);
  }

  @PatchMapping("/{id}")
  public AccountResponse updateAccount(@PathVariable UUID id, @RequestBody UpdateAccountRequest request) {
    return accountService.updateAccount(id, request);
  }

  @PutMapping("/{id}/credentials")
  public CredentialsResponse replaceCredentials(@PathVariable UUID id,
                                                @Valid @RequestBody ReplaceCredentialsRequest request) {
    return new CredentialsResponse(id, credentialService.replaceCredentials(id, request.getHeaders()));
  }

  @GetMapping("/{id}/ledger/checkpoint")
  public ResponseEntity<Checkpoint> checkpoint(@PathVariable UUID id) {
    return accountService.checkpoint(id)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }
}
