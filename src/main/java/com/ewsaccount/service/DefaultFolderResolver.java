package com.ewsaccount.service;

import com.ewsaccount.domain.Folder;
import com.ewsaccount.domain.FolderType;
import com.ewsaccount.errors.AccessDeniedException;
import com.ewsaccount.errors.AmbiguousDefaultException;
import com.ewsaccount.errors.FolderNotFoundException;
import com.ewsaccount.errors.NoUsableDefaultException;
import com.ewsaccount.localization.LocalizationTable;
import com.ewsaccount.transport.ExchangeService;
import com.ewsaccount.util.NameUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finds the default folder of a well-known type.
 * <ol>
 *   <li>Ask the server for the distinguished folder.</li>
 *   <li>Access denied: the account may still be allowed to query, so try a query on a handle and use it.</li>
 *   <li>Not found: scan the folder directory, matching localized names first and the
 *       distinguished flag second.</li>
 * </ol>
 * The scan never guesses: more than one surviving candidate is an error.
 * Caching is the caller's job, see {@link Account#getDefaultFolder(FolderType)}.
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultFolderResolver {

    private final ExchangeService exchangeService;
    private final LocalizationTable localizationTable;

    public Folder resolve(Account account, FolderType type) {
        try {
            log.debug("Testing default {} folder with GetFolder", type);
            return exchangeService.getFolderByDistinguishedId(account, type);
        } catch (AccessDeniedException e) {
            log.debug("Testing default {} folder with FindItem", type);
            Folder handle = Folder.handleFor(type);
            exchangeService.checkQueryAccess(account, handle);
            return handle;
        } catch (FolderNotFoundException e) {
            log.debug("Searching default {} folder in full folder list", type);
            return searchDirectory(account, type, e);
        }
    }

    private Folder searchDirectory(Account account, FolderType type, FolderNotFoundException notFound) {
        List<Folder> candidates = account.getFolders().get(type);

        Set<String> localized = localizationTable.namesFor(type, account.getLocale()).stream()
                .map(NameUtil::titleCase)
                .collect(Collectors.toSet());
        List<Folder> matches = candidates.stream()
                .filter(f -> f.getName() != null && localized.contains(NameUtil.titleCase(f.getName())))
                .collect(Collectors.toList());

        if (matches.isEmpty()) {
            // No folder with a localized name, fall back to the distinguished flag
            matches = candidates.stream()
                    .filter(Folder::isDistinguished)
                    .collect(Collectors.toList());
        }
        if (matches.isEmpty()) {
            throw new NoUsableDefaultException("No useable default " + type + " folders", notFound);
        }
        if (matches.size() > 1) {
            throw new AmbiguousDefaultException(type, matches);
        }
        log.debug("Default {} folder for {} is {}", type, account, matches.get(0));
        return matches.get(0);
    }
}
