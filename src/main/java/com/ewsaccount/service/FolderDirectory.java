package com.ewsaccount.service;

import com.ewsaccount.domain.Folder;
import com.ewsaccount.domain.FolderType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Account folders grouped by well-known type, in discovery order.
 * Every {@link FolderType} is present as a key, possibly with an empty list.
 */
public final class FolderDirectory {

    private final Map<FolderType, List<Folder>> byType;

    private FolderDirectory(Map<FolderType, List<Folder>> byType) {
        this.byType = byType;
    }

    /**
     * Classify folders by their type tag. Untagged folders count as {@link FolderType#OTHER}.
     */
    public static FolderDirectory classify(Iterable<Folder> folders) {
        Map<FolderType, List<Folder>> working = new EnumMap<>(FolderType.class);
        for (FolderType type : FolderType.values()) {
            working.put(type, new ArrayList<>());
        }
        for (Folder folder : folders) {
            FolderType type = folder.getType() != null ? folder.getType() : FolderType.OTHER;
            working.get(type).add(folder);
        }

        Map<FolderType, List<Folder>> frozen = new EnumMap<>(FolderType.class);
        working.forEach((type, list) -> frozen.put(type, Collections.unmodifiableList(list)));
        return new FolderDirectory(Collections.unmodifiableMap(frozen));
    }

    public List<Folder> get(FolderType type) {
        return byType.get(type);
    }

    public Map<FolderType, List<Folder>> asMap() {
        return byType;
    }

    /**
     * Total number of folders across all types
     */
    public int size() {
        return byType.values().stream().mapToInt(List::size).sum();
    }
}
