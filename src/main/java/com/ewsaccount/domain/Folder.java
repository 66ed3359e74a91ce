package com.ewsaccount.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Remote folder entity
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Folder {

    private String id;              // null for a handle addressed by distinguished id only
    private String changeKey;
    private String name;            // Display name, possibly localized
    private boolean distinguished;  // Server marks it as the canonical folder of its type
    @Builder.Default
    private FolderType type = FolderType.OTHER;

    /**
     * Lightweight handle for the distinguished folder of the given type.
     * Has no id; the call layer addresses it by {@link FolderType#getDistinguishedId()}.
     */
    public static Folder handleFor(FolderType type) {
        return Folder.builder()
                .type(type)
                .distinguished(true)
                .build();
    }

    @Override
    public String toString() {
        return type + "(" + (name != null ? name : type.getDistinguishedId()) + ")";
    }
}
