package com.paysync.controller;

import com.paysync.service.CollectionService;
import com.paysync.sync.CollectionStatus;
import com.paysync.sync.SyncMode;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/accounts/{id}/collections")
public class CollectionController {
  private final CollectionService collectionService;

  public CollectionController(CollectionService collectionService) {
    this.collectionService = collectionService;
  }

  @PostMapping
  @ResponseStatus(HttpStatus.ACCEPTED)
  public CollectionStatus start(@PathVariable UUID id,
                                @RequestParam(name = "mode", required = false) String mode) {
    return collectionService.start(id, parseMode(mode));
  }

  @PostMapping("/stop")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public CollectionStatus stop(@PathVariable UUID id) {
    return collectionService.requestStop(id);
  }

  @GetMapping
  public CollectionStatus status(@PathVariable UUID id) {
    return collectionService.status(id);
  }

  private static SyncMode parseMode(String mode) {
    try {
      return SyncMode.parse(mode);
    } catch (IllegalArgumentException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown mode: " + mode);
    }
  }
}
