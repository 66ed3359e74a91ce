package com.ewsaccount.localization;

import com.ewsaccount.domain.FolderType;

import java.util.Set;

/**
 * Display names a server may give a well-known folder, per locale.
 * Best effort only; used to pick a default folder when the server has no distinguished one.
 */
public interface LocalizationTable {

    /**
     * @return accepted display names, empty if the locale or type is unknown
     */
    Set<String> namesFor(FolderType type, String locale);
}
