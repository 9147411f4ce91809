package im.arun.lcms.model;

/**
 * Outcome of a catalog operation. Only {@link #OK} means the catalog was changed (or, for
 * lookups, that something was found); every other value leaves the catalog untouched.
 */
public enum CatalogStatus {
    OK,
    NOT_FOUND,
    DUPLICATE_REJECTED,
    INVALID_PATH,
    ROOT_PROTECTED,
    INVALID_INPUT;

    public boolean isOk() {
        return this == OK;
    }
}
