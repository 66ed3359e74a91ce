package com.ewsaccount.controller;

import com.ewsaccount.domain.Folder;
import com.ewsaccount.domain.FolderType;
import com.ewsaccount.errors.AccessDeniedException;
import com.ewsaccount.errors.AmbiguousDefaultException;
import com.ewsaccount.errors.ConfigurationConflictException;
import com.ewsaccount.errors.FolderNotFoundException;
import com.ewsaccount.errors.InvalidIdentityException;
import com.ewsaccount.errors.NoUsableDefaultException;
import com.ewsaccount.errors.TransportException;
import com.ewsaccount.service.Account;
import com.ewsaccount.service.AccountRegistry;
import com.ewsaccount.service.FolderDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Folder inspection REST API
 * - List registered accounts (GET /api/accounts)
 * - Folder directory (GET /api/accounts/{email}/folders)
 * - Default folder of a type (GET /api/accounts/{email}/folders/default/{type})
 * - Drop cached folders (DELETE /api/accounts/{email})
 */
@Slf4j
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class FolderController {

    private final AccountRegistry accountRegistry;

    /**
     * List accounts
     * GET /api/accounts
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listAccounts() {
        List<Map<String, Object>> accountList = accountRegistry.listAccounts().stream().map(account -> {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("email", account.getPrimarySmtpAddress());
            map.put("fullname", account.getFullname());
            map.put("accessType", account.getAccessType());
            map.put("locale", account.getLocale());
            return map;
        }).collect(Collectors.toList());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("count", accountList.size());
        response.put("accounts", accountList);
        return ResponseEntity.ok(response);
    }

    /**
     * Folder directory grouped by type
     * GET /api/accounts/{email}/folders
     */
    @GetMapping("/{email}/folders")
    public ResponseEntity<Map<String, Object>> listFolders(@PathVariable String email) {
        Account account = accountRegistry.getAccount(email);
        FolderDirectory directory = account.getFolders();

        Map<String, Object> byType = new LinkedHashMap<>();
        directory.asMap().forEach((type, folders) -> {
            if (!folders.isEmpty()) {
                byType.put(type.name(), folders.stream().map(this::folderJson).collect(Collectors.toList()));
            }
        });

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("email", account.getPrimarySmtpAddress());
        response.put("count", directory.size());
        response.put("folders", byType);
        return ResponseEntity.ok(response);
    }

    /**
     * Default folder of a well-known type
     * GET /api/accounts/{email}/folders/default/{type}, type like "inbox" or "sent-items"
     */
    @GetMapping("/{email}/folders/default/{type}")
    public ResponseEntity<Map<String, Object>> getDefaultFolder(@PathVariable String email,
                                                                @PathVariable String type) {
        FolderType folderType = parseType(type);
        if (folderType == null || !folderType.isWellKnown()) {
            return errorResponse(HttpStatus.BAD_REQUEST, "Unknown folder type: " + type);
        }

        Account account = accountRegistry.getAccount(email);
        Folder folder = account.getDefaultFolder(folderType);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("email", account.getPrimarySmtpAddress());
        response.put("type", folderType.name());
        response.put("folder", folderJson(folder));
        return ResponseEntity.ok(response);
    }

    /**
     * Drop the cached account
     * DELETE /api/accounts/{email}
     */
    @DeleteMapping("/{email}")
    public ResponseEntity<Map<String, Object>> evictAccount(@PathVariable String email) {
        if (!accountRegistry.evict(email)) {
            return errorResponse(HttpStatus.NOT_FOUND, "Account not found: " + email);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("message", "Account evicted.");
        response.put("email", email);
        return ResponseEntity.ok(response);
    }

    @ExceptionHandler({InvalidIdentityException.class, ConfigurationConflictException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException e) {
        return errorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({NoUsableDefaultException.class, FolderNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(RuntimeException e) {
        return errorResponse(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAccessDenied(AccessDeniedException e) {
        return errorResponse(HttpStatus.FORBIDDEN, e.getMessage());
    }

    @ExceptionHandler(AmbiguousDefaultException.class)
    public ResponseEntity<Map<String, Object>> handleAmbiguous(AmbiguousDefaultException e) {
        ResponseEntity<Map<String, Object>> response = errorResponse(HttpStatus.CONFLICT, e.getMessage());
        response.getBody().put("candidates",
                e.getCandidates().stream().map(this::folderJson).collect(Collectors.toList()));
        return response;
    }

    @ExceptionHandler(TransportException.class)
    public ResponseEntity<Map<String, Object>> handleTransport(TransportException e) {
        log.error("Remote call failed", e);
        return errorResponse(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    private Map<String, Object> folderJson(Folder folder) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", folder.getId());
        map.put("name", folder.getName());
        map.put("type", folder.getType().name());
        map.put("distinguished", folder.isDistinguished());
        return map;
    }

    private static FolderType parseType(String type) {
        try {
            return FolderType.valueOf(type.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}
