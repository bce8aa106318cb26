package com.questrail.sensorlink.profile;

/**
 * Raised when a profile catalog cannot be read or is structurally invalid.
 *
 * <p>This is the only fail-fast error in the core: catalogs are
 * construction-time configuration, and a broken one must stop startup
 * rather than silently map nothing.</p>
 */
public final class ProfileCatalogException extends RuntimeException
{
    public ProfileCatalogException(String message) {
        super(message);
    }

    public ProfileCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
