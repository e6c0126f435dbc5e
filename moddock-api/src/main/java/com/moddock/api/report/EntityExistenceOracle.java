package com.moddock.api.report;

/**
 * Confirms that a report target exists. Projects, versions and users are
 * owned by other parts of the platform.
 */
public interface EntityExistenceOracle {

    boolean projectExists(long projectId);

    boolean versionExists(long versionId);

    boolean userExists(long userId);
}
