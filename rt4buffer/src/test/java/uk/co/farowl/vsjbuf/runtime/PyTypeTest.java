// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Test the reduced type object {@link PyType}: the types of Java
 * objects, and the MRO along which the buffer slot is found.
 */
@DisplayName("A type object")
class PyTypeTest {

    @Test
    @DisplayName("of a Java object is found from its class")
    void ofJavaObject() {
        assertEquals("str", PyType.of("x").getName());
        assertEquals("int", PyType.of(1L).getName());
        assertEquals("int", PyType.of(BigInteger.TEN).getName());
        assertSame(PyType.OBJECT_TYPE, PyType.of(null));
        // A sub-class of a registered class inherits the type
        assertSame(PyType.OBJECT_TYPE, PyType.of(new ArrayList<>()));
        assertSame(PyType.TYPE, PyType.of(PyBytes.TYPE));
    }

    @Test
    @DisplayName("bool has int in its MRO")
    void boolMRO() {
        PyType bool = PyType.of(true);
        List<PyType> mro = bool.getMRO();
        assertEquals(3, mro.size());
        assertEquals("int", mro.get(1).getName());
        assertSame(PyType.OBJECT_TYPE, mro.get(2));
        assertNull(PyType.OBJECT_TYPE.getBase());
        assertTrue(bool.isSubTypeOf(mro.get(1)));
        assertFalse(mro.get(1).isSubTypeOf(bool));
    }

    @Test
    @DisplayName("provides a buffer slot only where one is defined")
    void bufferSlot() {
        assertNotNull(PyBytes.TYPE.lookupAsBuffer());
        assertNotNull(PyByteArray.TYPE.lookupAsBuffer());
        assertNotNull(PyMemoryView.TYPE.lookupAsBuffer());
        assertNull(PyType.of("x").lookupAsBuffer());
        assertNull(PyType.OBJECT_TYPE.lookupAsBuffer());
    }

    @Test
    @DisplayName("may not adopt a class twice")
    void adoptTwice() {
        assertThrows(IllegalArgumentException.class, () -> PyType
                .fromSpec(new PyType.Spec("string").adopt(String.class)));
    }

    @Test
    @DisplayName("of an exception is in the hierarchy of exceptions")
    void exceptions() {
        PyBaseException e = PyErr.format(PyExc.IndexError, "bad %d", 42);
        assertSame(PyExc.IndexError, PyType.of(e));
        assertTrue(e.getType().isSubTypeOf(PyExc.LookupError));
        assertTrue(e.getType().isSubTypeOf(PyExc.BaseException));
        assertEquals("IndexError: bad 42", e.toString());
        assertEquals("<class 'IndexError'>", PyExc.IndexError.toString());
    }
}
