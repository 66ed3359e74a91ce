package com.ewsaccount.domain;

import lombok.Value;

/**
 * Export payload targeted at a folder
 */
@Value
public class UploadItem {

    Folder folder;
    String data;
}
