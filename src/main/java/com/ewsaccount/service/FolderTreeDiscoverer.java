package com.ewsaccount.service;

import com.ewsaccount.domain.Depth;
import com.ewsaccount.domain.Folder;
import com.ewsaccount.transport.ExchangeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Walks the account's folder tree and classifies every folder by well-known type.
 * <p>
 * Some mailboxes have a "Top of Information Store" folder directly below the root. It holds only
 * folders owned by the account, so when present its immediate children are the working set and
 * shared/delegated folders mounted at the top level are left out. Without it, default folders can
 * sit anywhere, so the whole tree below the root is listed.
 */
@Slf4j
@RequiredArgsConstructor
public class FolderTreeDiscoverer {

    public static final String TOP_OF_INFORMATION_STORE = "Top of Information Store";

    private final ExchangeService exchangeService;

    public FolderDirectory discover(Account account, Folder root) {
        List<Folder> folders = exchangeService.listChildFolders(account, root, Depth.SHALLOW);

        Folder store = null;
        for (Folder folder : folders) {
            if (TOP_OF_INFORMATION_STORE.equals(folder.getName())) {
                store = folder;
                break;
            }
        }

        if (store != null) {
            log.debug("Listing folders below '{}' for {}", TOP_OF_INFORMATION_STORE, account);
            folders = exchangeService.listChildFolders(account, store, Depth.SHALLOW);
        } else {
            log.debug("No '{}' for {}, listing the full folder tree", TOP_OF_INFORMATION_STORE, account);
            folders = exchangeService.listChildFolders(account, root, Depth.DEEP);
        }

        FolderDirectory directory = FolderDirectory.classify(folders);
        log.debug("Discovered {} folders for {}", directory.size(), account);
        return directory;
    }
}
