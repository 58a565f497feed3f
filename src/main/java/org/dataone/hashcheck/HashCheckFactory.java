package org.dataone.hashcheck;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Properties;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.dataone.hashcheck.exceptions.HashCheckFactoryException;

/**
 * HashCheckFactory is a factory class that creates a HashCheck engine from the name of its
 * implementation class.
 */
public class HashCheckFactory {
    private static final Log logHashCheck = LogFactory.getLog(HashCheckFactory.class);

    public static final String DEFAULT_CLASS_PACKAGE = "org.dataone.hashcheck.FileHashCheck";

    /**
     * Factory method to generate a HashCheck
     *
     * @param classPackage        String of the class name, ex.
     *                            "org.dataone.hashcheck.FileHashCheck"
     * @param hashcheckProperties Properties object keyed by HashCheckProperties names, used to
     *                            build the engine's default config
     * @return HashCheck instance ready to accept requests
     * @throws HashCheckFactoryException When the class cannot be found or instantiated, or the
     *                                   properties are invalid
     */
    public static HashCheck getHashCheck(String classPackage, Properties hashcheckProperties)
        throws HashCheckFactoryException {
        if (classPackage == null || classPackage.trim().isEmpty()) {
            String errMsg = "HashCheckFactory - classPackage cannot be null or empty.";
            logHashCheck.error(errMsg);
            throw new HashCheckFactoryException(errMsg);
        }
        if (hashcheckProperties == null) {
            String errMsg = "HashCheckFactory - hashcheckProperties cannot be null.";
            logHashCheck.error(errMsg);
            throw new HashCheckFactoryException(errMsg);
        }

        logHashCheck.debug("Creating new 'HashCheck' from package: " + classPackage);
        HashCheck hashcheck;
        try {
            Class<?> hashCheckClass = Class.forName(classPackage);
            if (!HashCheck.class.isAssignableFrom(hashCheckClass)) {
                String errMsg = "HashCheckFactory - " + classPackage
                    + " does not implement HashCheck.";
                logHashCheck.error(errMsg);
                throw new HashCheckFactoryException(errMsg);
            }
            Constructor<?> constructor = hashCheckClass.getConstructor(Properties.class);
            hashcheck = (HashCheck) constructor.newInstance(hashcheckProperties);

        } catch (ClassNotFoundException cnfe) {
            String errMsg = "HashCheckFactory - Unable to find classPackage: " + classPackage
                + " - " + cnfe.getMessage();
            logHashCheck.error(errMsg);
            throw new HashCheckFactoryException(errMsg);

        } catch (NoSuchMethodException nsme) {
            String errMsg = "HashCheckFactory - Properties constructor not found for: "
                + classPackage + " - " + nsme.getMessage();
            logHashCheck.error(errMsg);
            throw new HashCheckFactoryException(errMsg);

        } catch (IllegalAccessException | InstantiationException e) {
            String errMsg = "HashCheckFactory - Unable to instantiate: " + classPackage + " - "
                + e.getMessage();
            logHashCheck.error(errMsg);
            throw new HashCheckFactoryException(errMsg);

        } catch (InvocationTargetException ite) {
            String errMsg = "HashCheckFactory - Error creating '" + classPackage
                + "' instance: " + ite.getCause();
            logHashCheck.error(errMsg);
            throw new HashCheckFactoryException(errMsg);
        }
        return hashcheck;
    }
}
