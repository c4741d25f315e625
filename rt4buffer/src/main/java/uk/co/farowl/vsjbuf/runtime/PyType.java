// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.runtime;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.vsjbuf.buffer.AsBuffer;

/**
 * A Python type object, reduced to what the buffer protocol needs from
 * the object model: a name, a single base, and the {@code as_buffer}
 * slot through which a type declares itself a provider of buffers.
 * <p>
 * Python types are created from a {@link Spec} by
 * {@link #fromSpec(Spec)}. Java classes that are not crafted Python
 * objects (that do not implement {@link WithClass}) are given a type
 * the first time {@link #of(Object)} meets them, unless a
 * specification has adopted them.
 */
public final class PyType implements WithClass {

    /** Logger for type creation. */
    static final Logger logger = LoggerFactory.getLogger(PyType.class);

    /** Types for Java classes, adopted or found by {@link #of(Object)}. */
    private static final Map<Class<?>, PyType> registry =
            new ConcurrentHashMap<>();

    /** The type {@code object}, root of every MRO. */
    public static final PyType OBJECT_TYPE =
            fromSpec(new Spec("object").adopt(Object.class));

    /** The type {@code type} (of which every type is an instance). */
    public static final PyType TYPE =
            fromSpec(new Spec("type").adopt(PyType.class));

    static {
        // Adopt the Java classes standing for common Python types.
        fromSpec(new Spec("str").adopt(String.class));
        PyType intType = fromSpec(new Spec("int").adopt(Integer.class,
                Long.class, BigInteger.class));
        fromSpec(new Spec("bool").base(intType).adopt(Boolean.class));
        fromSpec(new Spec("float").adopt(Double.class));
    }

    /** Name of the type. */
    private final String name;

    /** The base type (only {@code object} has none). */
    private final PyType base;

    /** Slot for obtaining a buffer, or {@code null}. */
    private final AsBuffer asBuffer;

    /**
     * Construct the type, not (yet) registering any Java class.
     *
     * @param name of the type
     * @param base of the type or {@code null} for {@code object}
     * @param asBuffer buffer slot or {@code null}
     */
    private PyType(String name, PyType base, AsBuffer asBuffer) {
        this.name = name;
        this.base = base;
        this.asBuffer = asBuffer;
    }

    /**
     * Create a type from its specification, and make it the type of
     * the Java classes the specification adopts.
     *
     * @param spec specifying the new type
     * @return the new type
     */
    public static PyType fromSpec(Spec spec) {
        // object is the only type without a base.
        PyType base = spec.base != null ? spec.base : OBJECT_TYPE;
        PyType type = new PyType(spec.name, base, spec.asBuffer);
        for (Class<?> c : spec.adopted) {
            PyType old = registry.putIfAbsent(c, type);
            if (old != null) {
                throw new IllegalArgumentException(String.format(
                        "%s already has type '%s'", c.getTypeName(),
                        old.name));
            }
        }
        logger.atDebug().setMessage("Created type '{}' (base '{}')")
                .addArgument(type.name)
                .addArgument(() -> base == null ? "" : base.name).log();
        return type;
    }

    /**
     * Determine the Python type of the given object.
     *
     * @param o the object
     * @return its Python type
     */
    public static PyType of(Object o) {
        if (o instanceof WithClass) {
            return ((WithClass)o).getType();
        } else if (o == null) {
            // Stand-in for None where Java null leaks through.
            return OBJECT_TYPE;
        } else {
            return forClass(o.getClass());
        }
    }

    /**
     * Find the type registered for a Java class, or the type of its
     * nearest registered super-class, registering the result against
     * {@code c} so the next look-up is direct.
     *
     * @param c Java class
     * @return the type for {@code c}
     */
    private static PyType forClass(Class<?> c) {
        PyType type = registry.get(c);
        if (type == null) {
            PyType found = null;
            for (Class<?> k = c.getSuperclass(); found == null;
                    k = k.getSuperclass()) {
                found = registry.get(k);
            }
            logger.atDebug().setMessage("Java class {} has type '{}'")
                    .addArgument(() -> c.getTypeName())
                    .addArgument(found.name).log();
            PyType old = registry.putIfAbsent(c, found);
            type = old != null ? old : found;
        }
        return type;
    }

    @Override
    public PyType getType() { return TYPE; }

    /**
     * Return the name of the type.
     *
     * @return name of the type
     */
    public String getName() { return name; }

    /**
     * Return the base of the type.
     *
     * @return base or {@code null} if this is {@code object}.
     */
    public PyType getBase() { return base; }

    /**
     * Return the method resolution order of the type. With only single
     * inheritance this is the chain of bases, starting with this type
     * and ending with {@code object}.
     *
     * @return the MRO of this type
     */
    public List<PyType> getMRO() {
        List<PyType> mro = new ArrayList<>();
        for (PyType t = this; t != null; t = t.base) { mro.add(t); }
        return Collections.unmodifiableList(mro);
    }

    /**
     * Search the MRO of this type for the first type defining the
     * {@code as_buffer} slot, and return that slot.
     *
     * @return the slot or {@code null} if no type in the MRO has one
     */
    public AsBuffer lookupAsBuffer() {
        for (PyType t = this; t != null; t = t.base) {
            if (t.asBuffer != null) { return t.asBuffer; }
        }
        return null;
    }

    /**
     * True iff {@code b} is this type or one of its bases.
     *
     * @param b candidate base
     * @return whether this is a sub-type of {@code b}
     */
    public boolean isSubTypeOf(PyType b) {
        for (PyType t = this; t != null; t = t.base) {
            if (t == b) { return true; }
        }
        return false;
    }

    @Override
    public String toString() { return "<class '" + name + "'>"; }

    /**
     * A specification from which a Python type may be created using
     * {@link PyType#fromSpec(Spec)}.
     */
    public static class Spec {

        private final String name;
        private PyType base;
        private AsBuffer asBuffer;
        private final List<Class<?>> adopted = new ArrayList<>();

        /**
         * Begin a specification of a type with the given name.
         *
         * @param name of the type
         */
        public Spec(String name) { this.name = name; }

        /**
         * Specify the base of the type (default {@code object}).
         *
         * @param base of the type
         * @return {@code this}
         */
        public Spec base(PyType base) {
            this.base = base;
            return this;
        }

        /**
         * Specify that the type provides buffers through the given
         * slot function.
         *
         * @param asBuffer slot function
         * @return {@code this}
         */
        public Spec buffer(AsBuffer asBuffer) {
            this.asBuffer = asBuffer;
            return this;
        }

        /**
         * Specify Java classes, not implementing {@link WithClass},
         * whose instances will be treated as having this type.
         *
         * @param classes to adopt
         * @return {@code this}
         */
        public Spec adopt(Class<?>... classes) {
            for (Class<?> c : classes) { adopted.add(c); }
            return this;
        }
    }
}
