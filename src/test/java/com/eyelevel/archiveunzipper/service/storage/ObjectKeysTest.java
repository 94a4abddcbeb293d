package com.eyelevel.archiveunzipper.service.storage;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ObjectKeysTest {

    @Test
    void leafName_AcceptsBothSeparators() {
        assertEquals("a.txt", ObjectKeys.leafName("a.txt"));
        assertEquals("a.txt", ObjectKeys.leafName("dir/sub/a.txt"));
        assertEquals("a.txt", ObjectKeys.leafName("dir\\sub\\a.txt"));
        assertEquals("", ObjectKeys.leafName("dir/"));
    }

    @Test
    void destinationKey_JoinsFolderAndLeaf() {
        assertEquals("drop/x.csv", ObjectKeys.destinationKey("drop", "x.csv"));
        assertEquals("drop/inbox/x.csv", ObjectKeys.destinationKey("drop/inbox", "x.csv"));
    }

    @Test
    void destinationKey_NormalizesBackslashes() {
        assertEquals("drop/inbox/x.csv", ObjectKeys.destinationKey("drop\\inbox", "x.csv"));
        assertEquals("drop/x.csv", ObjectKeys.destinationKey("drop\\", "x.csv"));
    }

    @Test
    void destinationKey_DoesNotDoubleTrailingSeparator() {
        assertEquals("drop/x.csv", ObjectKeys.destinationKey("drop/", "x.csv"));
    }

    @Test
    void destinationKey_EmptyFolderWritesAtRoot() {
        assertEquals("x.csv", ObjectKeys.destinationKey("", "x.csv"));
    }
}
