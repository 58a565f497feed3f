package org.dataone.hashcheck;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.util.Properties;

import org.dataone.hashcheck.config.HashCheckConfig.HashCheckProperties;
import org.dataone.hashcheck.digest.ChecksumAlgorithm;
import org.dataone.hashcheck.exceptions.HashCheckFactoryException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Test class for HashCheckFactory
 */
public class HashCheckFactoryTest {
    private HashCheck hashCheck;

    @BeforeEach
    public void getHashCheck() {
        Properties hashcheckProperties = new Properties();
        hashcheckProperties.setProperty(HashCheckProperties.algorithm.name(), "SHA-256");
        hashcheckProperties.setProperty(HashCheckProperties.workerThreads.name(), "2");

        try {
            hashCheck = HashCheckFactory.getHashCheck(
                HashCheckFactory.DEFAULT_CLASS_PACKAGE, hashcheckProperties);

        } catch (Exception e) {
            e.printStackTrace();
            fail("HashCheckFactoryTest - Exception encountered: " + e.getMessage());

        }
    }

    @AfterEach
    public void closeHashCheck() {
        if (hashCheck != null) {
            hashCheck.close();
        }
    }

    /**
     * Check that the factory returns a FileHashCheck built from the properties
     */
    @Test
    public void isHashCheck() {
        assertNotNull(hashCheck);
        assertTrue(hashCheck instanceof FileHashCheck);
        assertEquals(ChecksumAlgorithm.SHA_256, hashCheck.getDefaultConfig().algorithm());
        assertEquals(2, hashCheck.getDefaultConfig().workerThreads());
    }

    /**
     * Check that getHashCheck throws exception when classPackage is null or empty
     */
    @Test
    public void hashCheck_classPackageNullOrEmpty() {
        assertThrows(
            HashCheckFactoryException.class,
            () -> HashCheckFactory.getHashCheck(null, new Properties()));
        assertThrows(
            HashCheckFactoryException.class,
            () -> HashCheckFactory.getHashCheck("  ", new Properties()));
    }

    /**
     * Check that getHashCheck throws exception when properties are null
     */
    @Test
    public void hashCheck_nullProperties() {
        assertThrows(
            HashCheckFactoryException.class,
            () -> HashCheckFactory.getHashCheck(HashCheckFactory.DEFAULT_CLASS_PACKAGE, null));
    }

    /**
     * Check that getHashCheck throws exception when the class does not exist
     */
    @Test
    public void hashCheck_classNotFound() {
        assertThrows(
            HashCheckFactoryException.class,
            () -> HashCheckFactory.getHashCheck("org.dataone.hashcheck.Missing", new Properties()));
    }

    /**
     * Check that getHashCheck throws exception when the class is not a HashCheck
     */
    @Test
    public void hashCheck_notAHashCheck() {
        assertThrows(
            HashCheckFactoryException.class,
            () -> HashCheckFactory.getHashCheck("java.lang.String", new Properties()));
    }

    /**
     * Check that getHashCheck throws exception when a property cannot be parsed
     */
    @Test
    public void hashCheck_invalidProperty() {
        Properties hashcheckProperties = new Properties();
        hashcheckProperties.setProperty(HashCheckProperties.chunkSize.name(), "-5");

        assertThrows(
            HashCheckFactoryException.class, () -> HashCheckFactory.getHashCheck(
                HashCheckFactory.DEFAULT_CLASS_PACKAGE, hashcheckProperties));
    }
}
