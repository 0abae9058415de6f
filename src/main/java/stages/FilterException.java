package stages;

/**
 * Runtime failure of a filter on a particular buffer, e.g. a crop rectangle
 * that does not fit the (possibly already resized) image.
 */
public class FilterException extends Exception {

    private static final long serialVersionUID = 1L;

    public FilterException(String message) {
        super(message);
    }
}
