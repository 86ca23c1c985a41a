package com.photoorg.app.organize;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CollisionNamesTest {

    private static final String HASH = "3fa2c9d1e8b7aa00";

    @Test
    void attemptZeroIsThePathItself() {
        assertEquals("PHOTO/2023/04/IMG_1.jpg", CollisionNames.candidate("PHOTO/2023/04/IMG_1.jpg", HASH, 0));
    }

    @Test
    void laterAttemptsAddHashPrefixAndCounter() {
        assertEquals("PHOTO/2023/04/IMG_1_3fa2c9d1.jpg", CollisionNames.candidate("PHOTO/2023/04/IMG_1.jpg", HASH, 1));
        assertEquals("PHOTO/2023/04/IMG_1_3fa2c9d1_2.jpg", CollisionNames.candidate("PHOTO/2023/04/IMG_1.jpg", HASH, 2));
        assertEquals("PHOTO/2023/04/IMG_1_3fa2c9d1_7.jpg", CollisionNames.candidate("PHOTO/2023/04/IMG_1.jpg", HASH, 7));
    }

    @Test
    void handlesNamesWithoutExtensionOrDirectory() {
        assertEquals("README_3fa2c9d1", CollisionNames.candidate("README", HASH, 1));
        assertEquals("a.tar_3fa2c9d1.gz", CollisionNames.candidate("a.tar.gz", HASH, 1));
    }

    @Test
    void shortOrMissingHash() {
        assertEquals("abc", CollisionNames.hashPrefix("abc"));
        assertEquals("nohash", CollisionNames.hashPrefix(null));
        assertThrows(IllegalArgumentException.class, () -> CollisionNames.candidate("a.jpg", HASH, -1));
    }
}
