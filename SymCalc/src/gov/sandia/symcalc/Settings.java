/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.symcalc;

import org.apache.log4j.Logger;

/**
    Tolerances and recursion limits shared by the simplifier, integrator and solvers.
    Each value is initialized from a JVM system property. An application may also
    assign the fields directly before doing any work.
**/
public class Settings
{
    private static Logger logger = Logger.getLogger (Settings.class);

    public static double epsilon;           // Single tolerance for "numerically zero", used by both simplifier and solvers.
    public static int    simplifierPasses;  // Maximum number of whole-tree passes before Simplifier gives up on reaching a fixed point.
    public static int    integratorDepth;   // Maximum nesting of recursive strategy calls in the integration chain.
    public static int    solverDepth;       // Maximum nesting of recursive calls in the single-variable solver.
    public static int    multiplicityLimit; // Largest root multiplicity the solver will list for a factor raised to an integer power.
    public static int    systemRounds;      // Maximum number of elimination rounds in the system solver.
    public static int    expandLimit;       // Largest integer power of a sum that Expander will multiply out.
    public static int    limitDepth;        // Maximum number of times a limit applies l'Hopital's rule.

    static
    {
        load ();
    }

    /**
        (Re)reads every setting from system properties, falling back to defaults.
    **/
    public static void load ()
    {
        epsilon           = getDouble ("symcalc.epsilon",             1e-10);
        simplifierPasses  = getInt    ("symcalc.simplifier.passes",   20);
        integratorDepth   = getInt    ("symcalc.integrator.depth",    24);
        solverDepth       = getInt    ("symcalc.solver.depth",        32);
        multiplicityLimit = getInt    ("symcalc.solver.multiplicity", 64);
        systemRounds      = getInt    ("symcalc.system.rounds",       64);
        expandLimit       = getInt    ("symcalc.expand.limit",        16);
        limitDepth        = getInt    ("symcalc.limit.depth",         8);
    }

    public static double getDouble (String key, double defaultValue)
    {
        String value = System.getProperty (key);
        if (value == null) return defaultValue;
        try
        {
            return Double.parseDouble (value.trim ());
        }
        catch (NumberFormatException e)
        {
            logger.warn ("Ignoring malformed value for " + key + ": " + value);
            return defaultValue;
        }
    }

    public static int getInt (String key, int defaultValue)
    {
        String value = System.getProperty (key);
        if (value == null) return defaultValue;
        try
        {
            return Integer.parseInt (value.trim ());
        }
        catch (NumberFormatException e)
        {
            logger.warn ("Ignoring malformed value for " + key + ": " + value);
            return defaultValue;
        }
    }

    public static boolean isZero (double value)
    {
        return Math.abs (value) <= epsilon;
    }

    /**
        Tolerance test relative to the magnitude of the numbers that produced the value.
        Scales below 1 are treated as 1, so tiny inputs still get an absolute test.
    **/
    public static boolean isZero (double value, double scale)
    {
        return Math.abs (value) <= epsilon * Math.max (1, Math.abs (scale));
    }
}
