package com.winevt.resources.core.model;

import com.winevt.resources.store.AbstractAttributeContainer;

/**
 * Windows resource file (DLL or MUI) holding message tables, identified by the path
 * the EventLog provider defines for it.
 */
public class MessageFile extends AbstractAttributeContainer {

    private final String windowsPath;
    private final String windowsVersion;
    private final String fileVersion;
    private final String productVersion;

    public MessageFile(String windowsPath) {
        this(windowsPath, null, null, null);
    }

    public MessageFile(String windowsPath, String windowsVersion, String fileVersion, String productVersion) {
        this.windowsPath = windowsPath;
        this.windowsVersion = windowsVersion;
        this.fileVersion = fileVersion;
        this.productVersion = productVersion;
    }

    public String getWindowsPath() {
        return windowsPath;
    }

    public String getWindowsVersion() {
        return windowsVersion;
    }

    public String getFileVersion() {
        return fileVersion;
    }

    public String getProductVersion() {
        return productVersion;
    }

    @Override
    public String toString() {
        return "MessageFile{" +
                "identifier=" + getIdentifier() +
                ", windowsPath='" + windowsPath + '\'' +
                ", fileVersion='" + fileVersion + '\'' +
                '}';
    }
}
