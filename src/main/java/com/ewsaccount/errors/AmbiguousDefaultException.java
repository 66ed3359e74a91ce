package com.ewsaccount.errors;

import com.ewsaccount.domain.Folder;
import com.ewsaccount.domain.FolderType;
import lombok.Getter;

import java.util.List;

/**
 * More than one folder qualifies as the default for a well-known type
 */
@Getter
public class AmbiguousDefaultException extends EwsAccountException {
    private static final long serialVersionUID = 1L;

    private final FolderType folderType;
    private final transient List<Folder> candidates;

    public AmbiguousDefaultException(FolderType folderType, List<Folder> candidates) {
        super("Multiple possible default " + folderType + " folders: " + candidates);
        this.folderType = folderType;
        this.candidates = List.copyOf(candidates);
    }
}
