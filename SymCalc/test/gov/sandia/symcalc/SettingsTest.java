/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Test;

public class SettingsTest {

    @After
    public void restore() {
        System.clearProperty ("symcalc.epsilon");
        System.clearProperty ("symcalc.integrator.depth");
        System.clearProperty ("symcalc.system.rounds");
        System.clearProperty ("symcalc.limit.depth");
        Settings.load ();
    }

    @Test
    public void testDefaults() {
        Settings.load ();
        assertEquals (1e-10, Settings.epsilon, 0);
        assertEquals (20,    Settings.simplifierPasses);
        assertEquals (24,    Settings.integratorDepth);
        assertEquals (32,    Settings.solverDepth);
        assertEquals (64,    Settings.systemRounds);
        assertEquals (16,    Settings.expandLimit);
        assertEquals (64,    Settings.multiplicityLimit);
        assertEquals (8,     Settings.limitDepth);
    }

    @Test
    public void testProperties() {
        System.setProperty ("symcalc.epsilon",          "1e-6");
        System.setProperty ("symcalc.integrator.depth", " 5 ");
        System.setProperty ("symcalc.system.rounds",    "many");  // malformed, so default applies
        System.setProperty ("symcalc.limit.depth",      "3");
        Settings.load ();
        assertEquals (1e-6, Settings.epsilon, 0);
        assertEquals (5,    Settings.integratorDepth);
        assertEquals (64,   Settings.systemRounds);
        assertEquals (3,    Settings.limitDepth);
    }

    @Test
    public void testIsZero() {
        assertTrue  (Settings.isZero (1e-11));
        assertFalse (Settings.isZero (1e-9));
        assertTrue  (Settings.isZero (1e-7, 1e4));  // relative to scale
        assertFalse (Settings.isZero (1e-7, 1));
        assertTrue  (Settings.isZero (1e-11, 1e-20));  // small scales act as 1
    }
}
