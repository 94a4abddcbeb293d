package com.eyelevel.archiveunzipper.service.storage;

import org.apache.commons.io.FilenameUtils;

/**
 * Builds object names for extracted entries.
 */
public final class ObjectKeys {

    private ObjectKeys() {
    }

    /**
     * Returns the leaf name of an archive entry path, accepting both '/' and '\' as separators.
     * Directory paths yield an empty string.
     */
    public static String leafName(final String entryPath) {
        return FilenameUtils.getName(entryPath);
    }

    /**
     * Joins the destination folder and the leaf name, then normalizes every backslash to a forward slash.
     * An empty folder places the object at the container root; a folder that already ends with a
     * separator is not given a second one.
     */
    public static String destinationKey(final String destinationFolder, final String leafName) {
        final String joined;
        if (destinationFolder == null || destinationFolder.isEmpty()) {
            joined = leafName;
        } else if (destinationFolder.endsWith("/") || destinationFolder.endsWith("\\")) {
            joined = destinationFolder + leafName;
        } else {
            joined = destinationFolder + "/" + leafName;
        }
        return joined.replace('\\', '/');
    }
}
