package io.renderscratch.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Locates an installed {@link ScratchJsonCodec} through {@link ServiceLoader}.
 *
 * <p>Hosts that avoid ServiceLoader (GraalVM native-image) can construct a codec directly instead.
 */
public final class ScratchJsonCodecs {
    private ScratchJsonCodecs() {}

    /**
     * Looks up a codec with the thread context class loader, or this class's loader when the thread has none.
     */
    public static Optional<ScratchJsonCodec> load() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        return load(cl != null ? cl : ScratchJsonCodecs.class.getClassLoader());
    }

    /**
     * Returns the first codec registered under {@code META-INF/services}, or empty if none is installed.
     */
    public static Optional<ScratchJsonCodec> load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<ScratchJsonCodec> it = ServiceLoader.load(ScratchJsonCodec.class, cl).iterator();
        return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
    }
}
