/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc.language.type;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import gov.sandia.symcalc.language.Type;

import org.apache.commons.math3.complex.Complex;
import org.junit.Test;

public class ComplexScalarTest {

    @Test
    public void testReduce() {
        Type t = ComplexScalar.reduce (new Complex (2, 1e-14));
        assertTrue (t instanceof Scalar);
        assertEquals (2, ((Scalar) t).value, 0);

        t = ComplexScalar.reduce (new Complex (2, 0.5));
        assertTrue (t instanceof ComplexScalar);
    }

    @Test
    public void testPromotion() {
        Type sum = new Scalar (1).add (new ComplexScalar (0, 2));
        assertTrue (sum instanceof ComplexScalar);
        assertEquals (1, ((ComplexScalar) sum).getReal (),      0);
        assertEquals (2, ((ComplexScalar) sum).getImaginary (), 0);

        Type product = new ComplexScalar (0, 1).multiply (new ComplexScalar (0, 1));
        assertTrue (product.approximately (new Scalar (-1), 1e-15));
    }

    @Test
    public void testNegativeZero() {
        assertEquals (new Scalar (0), new Scalar (-0.0));
        assertEquals ("0", new Scalar (-0.0).toString ());
    }

    @Test
    public void testRender() {
        assertEquals ("2.5", new Scalar (2.5).toString ());
        assertEquals ("3",   new Scalar (3).toString ());
        assertFalse (new ComplexScalar (1, 2).toString ().isEmpty ());
    }
}
