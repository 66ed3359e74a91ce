package com.ewsaccount.service;

import com.ewsaccount.config.AccountProperties;
import com.ewsaccount.errors.InvalidIdentityException;
import com.ewsaccount.localization.LocalizationTable;
import com.ewsaccount.transport.Autodiscovery;
import com.ewsaccount.transport.ExchangeService;
import com.ewsaccount.util.NameUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Account registry service
 * - Builds accounts from the configured endpoint or via autodiscovery
 * - One Account instance per primary address, so folder caches are shared
 * - Eviction to pick up server-side folder changes
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountRegistry {

    private final ExchangeService exchangeService;
    private final ObjectProvider<Autodiscovery> autodiscovery;
    private final LocalizationTable localizationTable;
    private final AccountProperties properties;

    private final Map<String, Account> accounts = new ConcurrentHashMap<>();

    /**
     * Get the account for an address, creating it on first use
     */
    public Account getAccount(String email) {
        return getAccount(email, null);
    }

    /**
     * Get the account for an address, creating it with the given display name on first use
     */
    public Account getAccount(String email, String fullname) {
        String address = clean(email);
        Account account = accounts.computeIfAbsent(key(address), k -> createAccount(address, fullname));
        // Autodiscovery may report another primary address; make it resolve to the same instance
        accounts.putIfAbsent(key(account.getPrimarySmtpAddress()), account);
        return account;
    }

    /**
     * List registered accounts
     */
    public List<Account> listAccounts() {
        return accounts.values().stream().distinct().collect(Collectors.toList());
    }

    /**
     * Forget an account; the next lookup rebuilds it with fresh folder caches
     */
    public boolean evict(String email) {
        Account removed = accounts.remove(key(clean(email)));
        if (removed != null) {
            accounts.values().removeIf(a -> a == removed);
            log.info("Account evicted: {}", removed);
        }
        return removed != null;
    }

    private Account createAccount(String email, String fullname) {
        Account account = Account.builder()
                .primarySmtpAddress(email)
                .fullname(fullname)
                .accessType(properties.getAccessType())
                .autodiscover(properties.isAutodiscover())
                .credentials(properties.toCredentials())
                .config(properties.toProtocolConfig())
                .verifySsl(properties.isVerifySsl())
                .locale(properties.getLocale())
                .exchangeService(exchangeService)
                .autodiscovery(autodiscovery.getIfAvailable())
                .localizationTable(localizationTable)
                .build();
        log.info("Account registered: {} ({}, {})", account, account.getAccessType(), account.getVersion());
        return account;
    }

    private static String clean(String email) {
        String clean = NameUtil.stripAngleBrackets(email);
        if (clean == null || clean.isEmpty()) {
            throw new InvalidIdentityException("email is required");
        }
        return clean;
    }

    private static String key(String address) {
        return address.toLowerCase(Locale.ROOT);
    }
}
