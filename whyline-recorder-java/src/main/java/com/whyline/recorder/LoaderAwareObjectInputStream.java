package com.whyline.recorder;

import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectStreamClass;

/**
 * Resolves classes against a given loader first. Instrumented programs are defined by
 * their own class loader, which the default resolution would never consult.
 */
final class LoaderAwareObjectInputStream extends ObjectInputStream {

    private final ClassLoader loader;

    LoaderAwareObjectInputStream(InputStream in, ClassLoader loader) throws IOException {
        super(in);
        this.loader = loader;
    }

    @Override
    protected Class<?> resolveClass(ObjectStreamClass desc) throws IOException, ClassNotFoundException {
        if (loader != null) {
            try {
                return Class.forName(desc.getName(), false, loader);
            } catch (ClassNotFoundException e) {
                // primitives and JDK types fall through to the default lookup
            }
        }
        return super.resolveClass(desc);
    }
}
