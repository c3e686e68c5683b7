package schedulerapp.exception;

/**
 * Thrown when a lookup by id finds no stored row.
 *
 * <p>Stores report a miss as an empty {@link java.util.Optional}; operations that need the row
 * turn that into this exception, naming the kind of resource and the id that was asked for.
 *
 * @see PeriodicTaskNotFoundException
 */
public class ResourceNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String resource;
    private final transient Object id;

    /**
     * @param resource human-readable kind of row, e.g. {@code "Periodic task"}
     * @param id       the id that was looked up
     */
    public ResourceNotFoundException(final String resource, final Object id) {
        super(resource + " not found: " + id);
        this.resource = resource;
        this.id = id;
    }

    public String getResource() {
        return resource;
    }

    public Object getId() {
        return id;
    }
}
