package stages;

import image.PixelBuffer;
import ops.ParameterSet;

/**
 * A pixel transform. Implementations never modify {@code src}; they return
 * a new buffer.
 */
@FunctionalInterface
public interface Filter {

    PixelBuffer apply(PixelBuffer src, ParameterSet params) throws FilterException;
}
